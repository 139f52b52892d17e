package warden.core.model.auth;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-request authentication record shared along the authenticator chain.
 *
 * <p>Created once per inbound request by the dispatcher and mutated in place by the
 * authenticator that succeeds. Instances are request-scoped and must not be shared
 * between requests.
 */
public final class AuthenticationSession {

    private String subject;
    private Map<String, Object> extra;

    public AuthenticationSession() {
        this.subject = "";
        this.extra = new HashMap<>();
    }

    public String subject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject == null ? "" : subject;
    }

    /**
     * Additional claims describing the subject.
     */
    public Map<String, Object> extra() {
        return extra;
    }

    public void setExtra(Map<String, Object> extra) {
        this.extra = extra == null ? new HashMap<>() : extra;
    }

    @Override
    public String toString() {
        return "AuthenticationSession[subject=" + subject + ", extra=" + extra.keySet() + "]";
    }
}
