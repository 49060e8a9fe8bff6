package com.fastalert.core.spi.failure;

import com.fastalert.model.NotificationJob;
import lombok.Getter;

/**
 * 失败判定器 按异常类型给出决策
 */
public interface FailureDecider {

    /**
     * 根据异常做出决策
     */
    Decision decide(Throwable t, NotificationJob job);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final double backoffFactor;
        private final String code;
        private final String message;

        private Decision(Outcome o, Category c, double f, String code, String msg) {
            this.outcome = o; this.category = c; this.backoffFactor = f;
            this.code = code; this.message = msg;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, 1.0, null, null); }
        public Decision factor(double f){ return new Decision(outcome, category, f, code, message); }
        public Decision withCode(String code){ return new Decision(outcome, category, backoffFactor, code, message); }
        public Decision withMsg(String msg){ return new Decision(outcome, category, backoffFactor, code, msg); }
    }

    enum Outcome { RETRY, GIVE_UP }
    enum Category { OPEN_CIRCUIT, TIMEOUT, TRANSPORT, REJECTED, UNKNOWN }
}
