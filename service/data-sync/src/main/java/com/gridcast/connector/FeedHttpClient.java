package com.gridcast.connector;

import com.gridcast.config.ApplicationConfig;
import com.gridcast.exception.FetchException;
import com.gridcast.exception.PayloadUnchangedException;
import com.gridcast.exception.TransientFetchException;
import com.gridcast.model.FeedType;
import com.gridcast.model.PayloadFingerprint;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * 数据源共用的 HTTP 客户端：节流、重试、条件请求与负载指纹
 */
@Slf4j
@Component
public class FeedHttpClient {

    private final ApplicationConfig.Http httpConfig;
    private final ApiRateLimiter apiRateLimiter;
    private final OkHttpClient client;

    public FeedHttpClient(ApplicationConfig config, ApiRateLimiter apiRateLimiter) {
        this.httpConfig = config.getHttp();
        this.apiRateLimiter = apiRateLimiter;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(httpConfig.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(httpConfig.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .callTimeout(httpConfig.getCallTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .addInterceptor(chain -> {
                    Request originalRequest = chain.request();
                    Request newRequest = originalRequest.newBuilder()
                            .header("User-Agent", httpConfig.getUserAgent())
                            .build();
                    return chain.proceed(newRequest);
                })
                .build();
    }

    /**
     * 下载一个负载
     *
     * @param rejected 上次被判定格式错误的指纹；非 null 时发送条件请求，远端未变化则抛出 PayloadUnchangedException
     */
    public FetchedPayload get(FeedType feed, String candidateName, String url, PayloadFingerprint rejected)
            throws FetchException {
        Request.Builder builder = new Request.Builder().url(url).get();
        if (rejected != null) {
            if (rejected.getEtag() != null) builder.header("If-None-Match", rejected.getEtag());
            if (rejected.getLastModified() != null) builder.header("If-Modified-Since", rejected.getLastModified());
        }

        try (Response resp = executeWithRetries(feed, candidateName, builder.build())) {
            int code = resp.code();
            if (code == 304 && rejected != null) {
                throw new PayloadUnchangedException(candidateName);
            }
            if (!resp.isSuccessful()) {
                throw new TransientFetchException(candidateName, code,
                        String.format("非成功响应: code=%d url=%s", code, url));
            }
            ResponseBody body = resp.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            String etag = resp.header("ETag");
            String lastModified = resp.header("Last-Modified");
            String sha256 = sha256(bytes);

            if (rejected != null && (rejected.sameValidators(etag, lastModified) || rejected.sameContent(sha256))) {
                throw new PayloadUnchangedException(candidateName);
            }
            return new FetchedPayload(bytes, new PayloadFingerprint(etag, lastModified, sha256));
        } catch (IOException e) {
            throw new TransientFetchException(candidateName, "读取响应失败: " + url, e);
        }
    }

    /**
     * 429 按 Retry-After 等待；5xx 与网络错误指数退避重试；其余响应直接返回
     */
    private Response executeWithRetries(FeedType feed, String candidateName, Request req) throws FetchException {
        int retries = Math.max(1, httpConfig.getRetries());
        int attempts = 0;
        while (true) {
            try {
                apiRateLimiter.acquire(feed);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransientFetchException(candidateName, "等待节流许可时被中断", ie);
            }
            boolean lastAttempt = attempts == retries - 1;
            try {
                Response resp = client.newCall(req).execute();
                apiRateLimiter.afterResponse(feed, resp);
                int code = resp.code();

                if (code == 429 && !lastAttempt) {
                    log.info("收到429限流，节流后重试: {}", req.url());
                    resp.close();
                    attempts++;
                    continue;
                }
                if (code < 500 || lastAttempt) {
                    return resp;
                }
                log.warn("请求失败 code={}, 准备重试: {}", code, req.url());
                resp.close();
            } catch (IOException e) {
                log.warn("请求异常 (attempt {}/{}): {} -> {}", attempts + 1, retries, req.url(), e.getMessage());
                if (lastAttempt) {
                    throw new TransientFetchException(candidateName, "请求最终失败，所有重试已耗尽: " + req.url(), e);
                }
            }
            attempts++;
            long backoffMs = httpConfig.getBackoffBaseMs() * (1L << attempts);
            log.info("指数退避等待 {}ms 后重试", backoffMs);
            sleep(backoffMs);
        }
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }

    private void sleep(long ms) {
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
