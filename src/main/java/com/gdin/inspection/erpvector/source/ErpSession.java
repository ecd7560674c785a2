package com.gdin.inspection.erpvector.source;

import lombok.Value;

@Value
public class ErpSession {
    String db;
    int uid;
    String username;
}
