package com.gdin.inspection.erpvector.util;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.socket.ConnectionSocketFactory;
import org.apache.hc.client5.http.socket.PlainConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.core5.http.config.Registry;
import org.apache.hc.core5.http.config.RegistryBuilder;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;

import javax.net.ssl.SSLContext;
import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;

public class HttpClientUtil {

    public static CloseableHttpClient getApacheClient(Long timeoutInSeconds, boolean trustAllCertificates) throws NoSuchAlgorithmException, KeyStoreException, KeyManagementException {
        if (!trustAllCertificates && timeoutInSeconds == null) return HttpClients.createDefault();

        HttpClientBuilder builder = HttpClients.custom();
        if (trustAllCertificates) {
            // 自签名证书的内网 ERP 使用，生产环境请使用正规 CA
            SSLContext sslContext = SSLContextBuilder.create()
                    .loadTrustMaterial(null, (X509Certificate[] chain, String authType) -> true)
                    .build();
            SSLConnectionSocketFactory sslSocketFactory = new SSLConnectionSocketFactory(
                    sslContext,
                    (hostname, session) -> true
            );
            Registry<ConnectionSocketFactory> registry = RegistryBuilder.<ConnectionSocketFactory>create()
                    .register("http", PlainConnectionSocketFactory.getSocketFactory())
                    .register("https", sslSocketFactory)
                    .build();
            builder.setConnectionManager(new PoolingHttpClientConnectionManager(registry));
        }
        if (timeoutInSeconds != null) {
            RequestConfig requestConfig = RequestConfig.custom()
                    .setConnectTimeout(Timeout.ofSeconds(timeoutInSeconds))
                    .setConnectionRequestTimeout(Timeout.ofSeconds(timeoutInSeconds))
                    .setResponseTimeout(Timeout.ofSeconds(timeoutInSeconds))
                    .build();
            builder.setDefaultRequestConfig(requestConfig);
        }
        return builder.build();
    }
}
