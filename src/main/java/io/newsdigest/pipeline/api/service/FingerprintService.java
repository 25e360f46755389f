package io.newsdigest.pipeline.api.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class FingerprintService {

    private static final char SEPARATOR = '\u001F';

    /**
     * Hash of the normalized identity fields. Case and whitespace differences do not change the result.
     */
    public String fingerprint(String title, String body, String source) {
        String identity = normalize(title) + SEPARATOR + normalize(body) + SEPARATOR + normalize(source);

        return DigestUtils.sha256Hex(identity);
    }

    static String normalize(String value) {
        if (value == null) return "";

        return value.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }
}
