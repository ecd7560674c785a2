package com.gdin.inspection.erpvector.source;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.inspection.erpvector.config.properties.OdooProperties;
import com.gdin.inspection.erpvector.exception.TransientIoException;
import com.gdin.inspection.erpvector.util.HttpClientUtil;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Odoo JSON-RPC 客户端（/jsonrpc, service=common/object）。
 */
@Slf4j
public class OdooSourceClient implements ErpSourceClient {
    private final OdooProperties properties;
    private final CloseableHttpClient httpClient;
    private final AtomicLong requestId = new AtomicLong();
    private volatile ErpSession session;

    public OdooSourceClient(OdooProperties properties) {
        this.properties = properties;
        try {
            this.httpClient = HttpClientUtil.getApacheClient(properties.getTimeoutSeconds(), properties.isTrustAllCertificates());
        } catch (Exception e) {
            throw new IllegalStateException("failed to build http client for odoo", e);
        }
    }

    @Override
    public ErpSession authenticate() {
        ErpSession current = session;
        if (current != null) return current;
        synchronized (this) {
            if (session != null) return session;
            Object uid = call("common", "login", List.of(properties.getDb(), properties.getUsername(), properties.getPassword()));
            if (!(uid instanceof Number) || ((Number) uid).intValue() <= 0) {
                throw new ErpSourceException("odoo authentication failed for user " + properties.getUsername());
            }
            session = new ErpSession(properties.getDb(), ((Number) uid).intValue(), properties.getUsername());
            log.info("Authenticated to odoo {} as uid {}", properties.getDb(), session.getUid());
            return session;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> searchRead(String model, List<Object> domain, List<String> fields, ReadOptions options) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        if (fields != null && !fields.isEmpty()) kwargs.put("fields", fields);
        if (options != null) {
            if (options.getLimit() != null) kwargs.put("limit", options.getLimit());
            kwargs.put("offset", options.getOffset());
            if (StrUtil.isNotBlank(options.getOrder())) kwargs.put("order", options.getOrder());
        }
        Object result = executeKw(model, "search_read", List.of(domain == null ? List.of() : domain), kwargs);
        if (!(result instanceof List)) return List.of();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object row : (List<Object>) result) {
            if (row instanceof Map) rows.add((Map<String, Object>) row);
        }
        return rows;
    }

    @Override
    public long searchCount(String model, List<Object> domain) {
        Object result = executeKw(model, "search_count", List.of(domain == null ? List.of() : domain), Map.of());
        return result instanceof Number ? ((Number) result).longValue() : 0L;
    }

    private Object executeKw(String model, String method, List<Object> args, Map<String, Object> kwargs) {
        ErpSession s = authenticate();
        List<Object> params = new ArrayList<>();
        params.add(s.getDb());
        params.add(s.getUid());
        params.add(properties.getPassword());
        params.add(model);
        params.add(method);
        params.add(args);
        params.add(kwargs);
        return call("object", "execute_kw", params);
    }

    private Object call(String service, String method, List<Object> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("service", service);
        params.put("method", method);
        params.put("args", args);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("method", "call");
        body.put("params", params);
        body.put("id", requestId.incrementAndGet());

        HttpPost post = new HttpPost(StrUtil.removeSuffix(properties.getUrl(), "/") + "/jsonrpc");
        String responseText;
        try {
            post.setEntity(new StringEntity(IOUtil.jsonSerializeWithNoType(body), ContentType.APPLICATION_JSON));
            responseText = httpClient.execute(post, response -> {
                int code = response.getCode();
                String text = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
                if (code >= 500) throw new IOException("odoo http " + code);
                return text;
            });
        } catch (IOException e) {
            throw new TransientIoException("odoo " + service + "." + method + " failed: " + e.getMessage(), e);
        }

        Map<String, Object> response;
        try {
            response = IOUtil.jsonDeserializeWithNoType(responseText, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new TransientIoException("odoo returned malformed response", e);
        }
        Object error = response.get("error");
        if (error != null) {
            throw new ErpSourceException("odoo error in " + method + ": " + describeError(error));
        }
        return response.get("result");
    }

    @SuppressWarnings("unchecked")
    private static String describeError(Object error) {
        if (error instanceof Map) {
            Map<String, Object> e = (Map<String, Object>) error;
            Object data = e.get("data");
            if (data instanceof Map && ((Map<String, Object>) data).get("message") != null) {
                return String.valueOf(((Map<String, Object>) data).get("message"));
            }
            return String.valueOf(e.get("message"));
        }
        return String.valueOf(error);
    }
}
