package com.gdin.inspection.erpvector.integrity.json;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JsonFkConfig {
    private int version = 1;
    private String description;
    private List<JsonFkMapping> mappings = new ArrayList<>();
}
