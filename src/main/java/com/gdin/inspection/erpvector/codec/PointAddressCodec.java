package com.gdin.inspection.erpvector.codec;

import cn.hutool.core.util.StrUtil;

import java.util.List;

/**
 * 点位 ID 编解码。
 *
 * 格式: NNNNNNNN-MMMM-0000-0000-RRRRRRRRRRRR
 * <ul>
 *     <li>NNNNNNNN 命名空间编码（8 位）</li>
 *     <li>MMMM 模型 ID（4 位）</li>
 *     <li>0000-0000 保留段，必须全为 0</li>
 *     <li>RRRRRRRRRRRR 记录 ID（12 位）</li>
 * </ul>
 * 旧版两段格式 MMMM-RRRRRRRRRRRR 只解码不生成，固定视为数据记录。
 */
public final class PointAddressCodec {

    public static final int NAMESPACE_WIDTH = 8;
    public static final int MODEL_WIDTH = 4;
    public static final int RESERVED_WIDTH = 4;
    public static final int RECORD_WIDTH = 12;

    public static final int MAX_MODEL_ID = 9_999;
    public static final long MAX_RECORD_ID = 999_999_999_999L;

    private static final String RESERVED = "0000";

    private PointAddressCodec() {
    }

    public static String encode(PointNamespace namespace, int modelId, long recordId) {
        if (namespace == null) throw new EncodingException("namespace is required");
        if (modelId < 0 || modelId > MAX_MODEL_ID) {
            throw new EncodingException("model id " + modelId + " exceeds " + MODEL_WIDTH + "-digit segment");
        }
        if (recordId < 0 || recordId > MAX_RECORD_ID) {
            throw new EncodingException("record id " + recordId + " exceeds " + RECORD_WIDTH + "-digit segment");
        }
        return String.format("%08d-%04d-%s-%s-%012d", namespace.getCode(), modelId, RESERVED, RESERVED, recordId);
    }

    public static String encode(PointAddress address) {
        return encode(address.getNamespace(), address.getModelId(), address.getRecordId());
    }

    public static String encodeData(int modelId, long recordId) {
        return encode(PointNamespace.DATA_RECORD, modelId, recordId);
    }

    public static String encodeGraphEdge(int modelId, long recordId) {
        return encode(PointNamespace.GRAPH_EDGE, modelId, recordId);
    }

    public static String encodeSchema(long fieldId) {
        // schema 点位不属于任何业务模型，模型段固定为 0
        return encode(PointNamespace.SCHEMA_METADATA, 0, fieldId);
    }

    public static PointAddress decode(String id) {
        if (StrUtil.isBlank(id)) throw new DecodingException(String.valueOf(id), "empty id");
        List<String> segments = StrUtil.split(id.trim(), '-');
        if (segments.size() == 2) return decodeLegacy(id, segments);
        if (segments.size() != 5) {
            throw new DecodingException(id, "expected 5 segments but got " + segments.size());
        }
        long nsCode = parseSegment(id, segments.get(0), NAMESPACE_WIDTH, "namespace");
        long modelId = parseSegment(id, segments.get(1), MODEL_WIDTH, "model");
        parseSegment(id, segments.get(2), RESERVED_WIDTH, "reserved");
        parseSegment(id, segments.get(3), RESERVED_WIDTH, "reserved");
        if (!RESERVED.equals(segments.get(2)) || !RESERVED.equals(segments.get(3))) {
            throw new DecodingException(id, "reserved segments must be zero");
        }
        long recordId = parseSegment(id, segments.get(4), RECORD_WIDTH, "record");

        PointNamespace namespace = PointNamespace.fromCode((int) nsCode);
        if (namespace == null) throw new DecodingException(id, "unknown namespace code " + nsCode);
        return new PointAddress(namespace, (int) modelId, recordId, false);
    }

    /** 解码失败返回 null */
    public static PointAddress tryDecode(String id) {
        try {
            return decode(id);
        } catch (DecodingException e) {
            return null;
        }
    }

    public static boolean isValid(String id) {
        return tryDecode(id) != null;
    }

    public static boolean isLegacy(String id) {
        PointAddress address = tryDecode(id);
        return address != null && address.isLegacy();
    }

    private static PointAddress decodeLegacy(String id, List<String> segments) {
        long modelId = parseSegment(id, segments.get(0), MODEL_WIDTH, "model");
        long recordId = parseSegment(id, segments.get(1), RECORD_WIDTH, "record");
        return new PointAddress(PointNamespace.DATA_RECORD, (int) modelId, recordId, true);
    }

    private static long parseSegment(String id, String segment, int width, String name) {
        if (segment.isEmpty()) throw new DecodingException(id, "empty " + name + " segment");
        if (segment.length() != width) {
            throw new DecodingException(id, name + " segment must be " + width + " digits");
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') throw new DecodingException(id, "non-numeric " + name + " segment");
        }
        return Long.parseLong(segment);
    }
}
