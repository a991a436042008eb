package com.gdin.radiology.report.util;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;

import javax.net.ssl.SSLContext;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;

public class HttpClientUtil {

    /**
     * @param timeoutInSeconds   连接、取连接、响应的统一超时，null 表示使用默认值
     * @param trustAllCertificates 信任所有证书并关闭主机名校验，仅用于内网自签名证书
     */
    public static CloseableHttpClient getApacheClient(Long timeoutInSeconds, boolean trustAllCertificates) throws GeneralSecurityException {
        if (!trustAllCertificates && timeoutInSeconds == null) return HttpClients.createDefault();

        HttpClientBuilder builder = HttpClients.custom();
        if (trustAllCertificates) {
            // 1. 构建 SSLContext（信任所有证书，生产环境请使用正规 CA）
            SSLContext sslContext = SSLContextBuilder.create()
                    .loadTrustMaterial(null, (X509Certificate[] chain, String authType) -> true)
                    .build();
            // 2. 关闭主机名校验
            SSLConnectionSocketFactory sslSocketFactory = SSLConnectionSocketFactoryBuilder.create()
                    .setSslContext(sslContext)
                    .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                    .build();
            // 3. 用这个 socket factory 创建连接管理器
            PoolingHttpClientConnectionManager connManager = PoolingHttpClientConnectionManagerBuilder.create()
                    .setSSLSocketFactory(sslSocketFactory)
                    .build();
            builder.setConnectionManager(connManager);
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
