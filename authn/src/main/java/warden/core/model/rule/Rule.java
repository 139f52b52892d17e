package warden.core.model.rule;

import java.util.List;

/**
 * A matched access rule, as far as the authentication stage needs it.
 *
 * @param id             rule identifier, used in logs
 * @param authenticators authenticators to try, in order
 */
public record Rule(String id, List<RuleHandler> authenticators) {

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        authenticators = authenticators == null ? List.of() : List.copyOf(authenticators);
    }
}
