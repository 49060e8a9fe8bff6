package com.fastalert.core.fingerprint;

import com.fastalert.model.AlertFact;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 告警指纹: md5(kind:subjectType:subjectId:title), 空字段按空串处理
 * 碰撞视为同一告警
 */
public class FingerprintEngine {

    private static final char SEP = ':';

    public String fingerprint(AlertFact fact) {
        return fingerprint(fact.getKind(), fact.getSubjectType(), fact.getSubjectId(), fact.getTitle());
    }

    public String fingerprint(String kind, String subjectType, String subjectId, String title) {
        String key = nz(kind) + SEP + nz(subjectType) + SEP + nz(subjectId) + SEP + nz(title);
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
