package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.exception.ErrorCategory;
import io.newsdigest.pipeline.api.exception.FeedFetchException;
import io.newsdigest.pipeline.config.HttpConfig;
import io.newsdigest.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Downloads raw feed documents. Transient failures are retried with backoff; anything else surfaces at once.
 */
@Service
public class FeedHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(FeedHttpClient.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final HttpConfig http;

    public FeedHttpClient(RssConfig rssConfig) {
        this.http = rssConfig.http();
    }

    @Retryable(
            retryFor = FeedFetchException.class,
            exceptionExpression = "category.isTransient()",
            maxAttemptsExpression = "#{@rssProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@rssProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public byte[] fetch(String url) throws FeedFetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.isBlank()) {
                throw new FeedFetchException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            logger.debug("Fetching feed: {}", url);

            connection = (HttpURLConnection) URI.create(url.trim()).toURL().openConnection();
            configureConnection(connection);
            connection.connect();

            validateHttpResponse(connection, url);

            return readBody(connection);

        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new FeedFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedFetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedFetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedFetchException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(http.connectTimeout());
        connection.setReadTimeout(http.readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip, deflate");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedFetchException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND, responseCode);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedFetchException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN, responseCode);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedFetchException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED, responseCode);

            case 429:
                throw new FeedFetchException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED, responseCode);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedFetchException("Server error (500): " + url, ErrorCategory.SERVER_ERROR, responseCode);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedFetchException("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE, responseCode);

            default:
                if (responseCode < 200 || responseCode >= 300) {
                    throw new FeedFetchException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                            ErrorCategory.HTTP_ERROR, responseCode);
                }
        }
    }

    private byte[] readBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();

        String encoding = connection.getContentEncoding();
        if ("gzip".equalsIgnoreCase(encoding)) {
            inputStream = new GZIPInputStream(inputStream);
        } else if ("deflate".equalsIgnoreCase(encoding)) {
            inputStream = new InflaterInputStream(inputStream);
        }

        try (InputStream body = inputStream) {
            return body.readAllBytes();
        }
    }

    private String nextUserAgent() {
        List<String> userAgents = http.userAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "news-pipeline/0.1";
        }
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isFeedContentType(String contentType) {
        String lowerContentType = contentType.toLowerCase();
        return lowerContentType.contains("xml") ||
                lowerContentType.contains("rss") ||
                lowerContentType.contains("atom") ||
                lowerContentType.contains("text");
    }
}
