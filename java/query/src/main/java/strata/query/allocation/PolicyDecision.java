/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package strata.query.allocation;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Whether a request may be admitted. A throttled request may be retried after a delay. A rejected request should not
 * be retried as it is.
 */
public class PolicyDecision {

    private static final PolicyDecision ALLOW = new PolicyDecision(Type.ALLOW, null, null, null);

    private final Type type;
    private final String policyName;
    private final String reason;
    private final Duration retryAfter;

    private PolicyDecision(Type type, String policyName, String reason, Duration retryAfter) {
        this.type = type;
        this.policyName = policyName;
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public static PolicyDecision allow() {
        return ALLOW;
    }

    /**
     * Creates a decision to turn a request away for now.
     *
     * @param  policyName the policy that made the decision
     * @param  reason     why the request was turned away
     * @param  retryAfter how long to wait before retrying
     * @return            the decision
     */
    public static PolicyDecision throttle(String policyName, String reason, Duration retryAfter) {
        return new PolicyDecision(Type.THROTTLE, policyName, reason,
                Objects.requireNonNull(retryAfter, "retryAfter must not be null"));
    }

    /**
     * Creates a decision to refuse a request.
     *
     * @param  policyName the policy that made the decision
     * @param  reason     why the request was refused
     * @return            the decision
     */
    public static PolicyDecision reject(String policyName, String reason) {
        return new PolicyDecision(Type.REJECT, policyName, reason, null);
    }

    /**
     * Derives the decision from a quota allowance. An allowance that cannot run is a throttle if it says when to retry,
     * or otherwise a rejection.
     *
     * @param  policyName the policy that computed the allowance
     * @param  allowance  the allowance
     * @return            the decision
     */
    public static PolicyDecision fromAllowance(String policyName, QuotaAllowance allowance) {
        if (allowance.canRun()) {
            return allow();
        }
        String reason = String.valueOf(allowance.getExplanation().getOrDefault("reason", allowance.getSuggestion()));
        return allowance.getRetryAfter()
                .map(retryAfter -> throttle(policyName, reason, retryAfter))
                .orElseGet(() -> reject(policyName, reason));
    }

    public Type getType() {
        return type;
    }

    public boolean isAllowed() {
        return type == Type.ALLOW;
    }

    public Optional<String> getPolicyName() {
        return Optional.ofNullable(policyName);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PolicyDecision that = (PolicyDecision) o;
        return type == that.type && Objects.equals(policyName, that.policyName)
                && Objects.equals(reason, that.reason) && Objects.equals(retryAfter, that.retryAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, policyName, reason, retryAfter);
    }

    @Override
    public String toString() {
        return "PolicyDecision{type=" + type + ", policyName=" + policyName
                + ", reason=" + reason + ", retryAfter=" + retryAfter + '}';
    }

    /**
     * The kinds of decision.
     */
    public enum Type {
        ALLOW, THROTTLE, REJECT
    }
}
