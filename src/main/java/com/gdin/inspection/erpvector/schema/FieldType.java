package com.gdin.inspection.erpvector.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.inspection.erpvector.filter.FilterOperator;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.gdin.inspection.erpvector.filter.FilterOperator.*;

/**
 * ERP 字段类型以及各类型允许的过滤操作符。
 */
public enum FieldType {
    CHAR, TEXT, HTML, SELECTION, KEYWORD,
    INTEGER, FLOAT, MONETARY,
    BOOLEAN,
    DATE, DATETIME,
    MANY2ONE, ONE2MANY, MANY2MANY,
    JSON, BINARY,
    UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FieldType parse(String raw) {
        if (raw == null) return UNKNOWN;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "char": return CHAR;
            case "text": return TEXT;
            case "html": return HTML;
            case "selection": return SELECTION;
            case "keyword":
            case "string": return KEYWORD;
            case "integer": return INTEGER;
            case "float": return FLOAT;
            case "monetary": return MONETARY;
            case "boolean": return BOOLEAN;
            case "date": return DATE;
            case "datetime": return DATETIME;
            case "many2one": return MANY2ONE;
            case "one2many": return ONE2MANY;
            case "many2many": return MANY2MANY;
            case "json": return JSON;
            case "binary": return BINARY;
            default: return UNKNOWN;
        }
    }

    public boolean isText() {
        return this == CHAR || this == TEXT || this == HTML || this == SELECTION || this == KEYWORD;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == MONETARY;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    public boolean isOrderable() {
        return isNumeric() || isTemporal();
    }

    public boolean isRelational() {
        return this == MANY2ONE || this == ONE2MANY || this == MANY2MANY;
    }

    public boolean isToMany() {
        return this == ONE2MANY || this == MANY2MANY;
    }

    public Set<FilterOperator> legalOperators() {
        if (isOrderable()) return EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, IN);
        if (isText()) return EnumSet.of(EQ, NEQ, IN, CONTAINS);
        switch (this) {
            case BOOLEAN:
            case MANY2ONE:
                return EnumSet.of(EQ, NEQ, IN);
            case ONE2MANY:
            case MANY2MANY:
                return EnumSet.of(EQ, IN);
            case JSON:
                return EnumSet.of(CONTAINS);
            default:
                return EnumSet.noneOf(FilterOperator.class);
        }
    }
}
