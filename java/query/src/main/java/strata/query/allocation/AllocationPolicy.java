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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.core.tenant.TenantContext;
import strata.query.config.RuntimeConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decides whether to admit requests against a dataset based on how much of a tenant's quota they use. Each policy
 * declares which tenant dimensions it tracks quota by, and the configs that control its limits. Config values are held
 * in the runtime config, so they can be changed while the process runs.
 * <p>
 * Every policy has configs to turn it on and off, to run it in dry run mode where its decisions are only recorded, to
 * require its tenant dimensions on every request, and to set the threads a request may use.
 */
public abstract class AllocationPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(AllocationPolicy.class);

    public static final String IS_ACTIVE = "is_active";
    public static final String IS_ENFORCED = "is_enforced";
    public static final String IS_MANDATORY = "is_mandatory";
    public static final String MAX_THREADS = "max_threads";

    private static final List<AllocationPolicyConfigDefinition> COMMON_DEFINITIONS = List.of(
            intConfig(IS_ACTIVE, "Whether this policy is applied to requests at all, 1 or 0", 1),
            intConfig(IS_ENFORCED, "Whether this policy's decisions are applied, or only recorded, 1 or 0", 1),
            intConfig(IS_MANDATORY, "Whether to reject requests missing a required tenant dimension, 1 or 0", 0),
            intConfig(MAX_THREADS, "The maximum number of threads a request may use", 10));

    private final String datasetKey;
    private final List<String> requiredTenantTypes;
    private final RuntimeConfig runtimeConfig;
    private final Supplier<Instant> timeSupplier;
    private final Map<String, AllocationPolicyConfigDefinition> definitions;

    protected AllocationPolicy(AllocationPolicyArgs args, List<AllocationPolicyConfigDefinition> policyDefinitions) {
        if (args.getRequiredTenantTypes().isEmpty()) {
            throw new IllegalArgumentException(getName() + " must require at least one tenant type");
        }
        datasetKey = args.getDatasetKey();
        requiredTenantTypes = args.getRequiredTenantTypes();
        runtimeConfig = args.getRuntimeConfig();
        timeSupplier = args.getTimeSupplier();
        definitions = Collections.unmodifiableMap(
                applyOverrides(combine(policyDefinitions), args.getDefaultConfigOverrides()));
    }

    /**
     * Assesses whether a request may be admitted.
     *
     * @param  requestId      the ID of the request
     * @param  tenant         who the request is made on behalf of
     * @param  estimatedBytes the estimated bytes the request will scan
     * @return                the assessment
     */
    public PolicyEvaluation evaluate(String requestId, TenantContext tenant, long estimatedBytes) {
        PolicyMode mode = getMode();
        if (mode == PolicyMode.INACTIVE) {
            return PolicyEvaluation.skipped(getName(), mode,
                    QuotaAllowance.unrestricted(getMaxThreads(), "policy is inactive"));
        }
        List<String> missing = tenant.findMissing(requiredTenantTypes);
        if (!missing.isEmpty()) {
            return evaluateMissingDimensions(requestId, mode, missing);
        }
        TenantKey key = TenantKey.from(tenant, requiredTenantTypes);
        QuotaAllowance allowance = computeQuotaAllowance(new PolicyRequest(requestId, tenant, key, estimatedBytes));
        PolicyEvaluation evaluation = PolicyEvaluation.assessed(getName(), mode, allowance, getMaxThreads());
        if (evaluation.isDryRunViolation()) {
            LOGGER.warn("Dry run for dataset {}: {} would have given decision {} for request {} from tenant {}",
                    datasetKey, getName(), evaluation.getDecision(), requestId, key);
        } else if (!evaluation.getDecision().isAllowed()) {
            LOGGER.info("Dataset {}: {} gave decision {} for request {} from tenant {}",
                    datasetKey, getName(), evaluation.getDecision(), requestId, key);
        }
        return evaluation;
    }

    /**
     * Updates the quota used by a tenant after a request this policy admitted is finished with.
     *
     * @param requestId the ID of the request
     * @param tenant    who the request was made on behalf of
     * @param outcome   what happened to the request
     */
    public void updateQuotaBalance(String requestId, TenantContext tenant, QueryOutcome outcome) {
        if (!tenant.hasAll(requiredTenantTypes)) {
            return;
        }
        TenantKey key = TenantKey.from(tenant, requiredTenantTypes);
        updateBalance(new PolicyRequest(requestId, tenant, key, 0), outcome);
    }

    /**
     * Computes the allowance for a request. Called only when the policy is active and every required tenant dimension
     * is set. If the request is admitted, any quota it holds while running must be taken here.
     *
     * @param  request the request
     * @return         the allowance
     */
    protected abstract QuotaAllowance computeQuotaAllowance(PolicyRequest request);

    /**
     * Releases or records quota after a request this policy admitted is finished with.
     *
     * @param request the request
     * @param outcome what happened to the request
     */
    protected abstract void updateBalance(PolicyRequest request, QueryOutcome outcome);

    /**
     * Discards all quota usage tracked by this policy.
     */
    public abstract void resetQuotaState();

    public String getName() {
        return getClass().getSimpleName();
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    public List<String> getRequiredTenantTypes() {
        return requiredTenantTypes;
    }

    public PolicyMode getMode() {
        return PolicyMode.from(getLongConfig(IS_ACTIVE) != 0, getLongConfig(IS_ENFORCED) != 0);
    }

    public long getMaxThreads() {
        return getLongConfig(MAX_THREADS);
    }

    public List<AllocationPolicyConfigDefinition> getConfigDefinitions() {
        return List.copyOf(definitions.values());
    }

    /**
     * Lists the current value of every config. Includes every value set for a parameterised config.
     *
     * @return the config values
     */
    public List<AllocationPolicyConfigValue> getCurrentConfigs() {
        List<AllocationPolicyConfigValue> values = new ArrayList<>();
        for (AllocationPolicyConfigDefinition definition : definitions.values()) {
            if (!definition.isParameterised()) {
                values.add(new AllocationPolicyConfigValue(definition, Map.of(), getConfigValue(definition.getName())));
            }
        }
        runtimeConfig.getAllWithPrefix(configKeyPrefix()).forEach((key, value) -> {
            String suffix = key.substring(configKeyPrefix().length());
            int paramsStart = suffix.indexOf('.');
            if (paramsStart < 0) {
                return;
            }
            AllocationPolicyConfigDefinition definition = definitions.get(suffix.substring(0, paramsStart));
            if (definition == null || !definition.isParameterised()) {
                return;
            }
            parseParams(suffix.substring(paramsStart + 1)).ifPresent(params -> values.add(
                    new AllocationPolicyConfigValue(definition, params, readValue(definition, key))));
        });
        return values;
    }

    /**
     * Retrieves the current value of a config that is not parameterised.
     *
     * @param  name                     the config name
     * @return                          the value, or its default if it is not set
     * @throws IllegalArgumentException if the config does not exist
     */
    public Object getConfigValue(String name) {
        return getConfigValue(name, Map.of());
    }

    /**
     * Retrieves the current value of a config.
     *
     * @param  name                     the config name
     * @param  params                   the parameter values
     * @return                          the value, or its default if it is not set
     * @throws IllegalArgumentException if the config does not exist, or the parameters do not match it
     */
    public Object getConfigValue(String name, Map<String, String> params) {
        AllocationPolicyConfigDefinition definition = getDefinition(name);
        definition.validateParams(params);
        return readValue(definition, definition.buildKey(configKeyPrefix(), params));
    }

    /**
     * Sets the value of a config.
     *
     * @param  name                     the config name
     * @param  value                    the value
     * @param  params                   the parameter values, empty if the config is not parameterised
     * @throws IllegalArgumentException if the config does not exist, the parameters do not match it, or the value is
     *                                  not of the right type
     */
    public void setConfigValue(String name, String value, Map<String, String> params) {
        AllocationPolicyConfigDefinition definition = getDefinition(name);
        definition.validateParams(params);
        definition.getValueType().parse(value);
        String key = definition.buildKey(configKeyPrefix(), params);
        runtimeConfig.set(key, value);
        LOGGER.info("Set config {} to {}", key, value);
    }

    /**
     * Removes the value of a config, so that its default applies.
     *
     * @param  name                     the config name
     * @param  params                   the parameter values, empty if the config is not parameterised
     * @throws IllegalArgumentException if the config does not exist, or the parameters do not match it
     */
    public void deleteConfigValue(String name, Map<String, String> params) {
        AllocationPolicyConfigDefinition definition = getDefinition(name);
        definition.validateParams(params);
        String key = definition.buildKey(configKeyPrefix(), params);
        runtimeConfig.delete(key);
        LOGGER.info("Deleted config {}", key);
    }

    protected long getLongConfig(String name) {
        return ((Number) getConfigValue(name)).longValue();
    }

    protected String getStringConfig(String name) {
        return String.valueOf(getConfigValue(name));
    }

    /**
     * Retrieves a parameterised whole number config if it is set, falling back to nothing if it is not.
     *
     * @param  name   the config name
     * @param  params the parameter values
     * @return        the value, if one is set and is not negative
     */
    protected Optional<Long> getLongOverride(String name, Map<String, String> params) {
        long value = ((Number) getConfigValue(name, params)).longValue();
        return value < 0 ? Optional.empty() : Optional.of(value);
    }

    protected Instant now() {
        return timeSupplier.get();
    }

    protected Supplier<Instant> getTimeSupplier() {
        return timeSupplier;
    }

    /**
     * Creates a definition of a whole number config that is not parameterised.
     *
     * @param  name         the name
     * @param  description  the description
     * @param  defaultValue the default value
     * @return              the definition
     */
    protected static AllocationPolicyConfigDefinition intConfig(String name, String description, long defaultValue) {
        return AllocationPolicyConfigDefinition.builder()
                .name(name).description(description)
                .valueType(ConfigValueType.INT).defaultValue(defaultValue)
                .build();
    }

    private PolicyEvaluation evaluateMissingDimensions(String requestId, PolicyMode mode, List<String> missing) {
        if (getLongConfig(IS_MANDATORY) == 0) {
            return PolicyEvaluation.skipped(getName(), mode, QuotaAllowance.unrestricted(getMaxThreads(),
                    "tenant dimensions " + missing + " not set, policy does not apply"));
        }
        QuotaAllowance rejection = QuotaAllowance.builder()
                .canRun(false).maxThreads(0)
                .suggestion("set tenant dimensions " + requiredTenantTypes)
                .explanation(Map.of("reason", "missing required tenant dimensions " + missing))
                .build();
        PolicyEvaluation evaluation = PolicyEvaluation.assessed(getName(), mode, rejection, getMaxThreads());
        LOGGER.warn("Dataset {}: {} found request {} missing required tenant dimensions {}",
                datasetKey, getName(), requestId, missing);
        return evaluation;
    }

    private Object readValue(AllocationPolicyConfigDefinition definition, String key) {
        Optional<String> value = runtimeConfig.get(key);
        if (value.isEmpty()) {
            return definition.getDefaultValue();
        }
        try {
            return definition.getValueType().parse(value.get());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Ignoring invalid value for config {}, using default {}", key, definition.getDefaultValue(), e);
            return definition.getDefaultValue();
        }
    }

    private AllocationPolicyConfigDefinition getDefinition(String name) {
        AllocationPolicyConfigDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException(getName() + " has no config named " + name);
        }
        return definition;
    }

    private String configKeyPrefix() {
        return datasetKey + "." + getName() + ".";
    }

    private static Optional<Map<String, String>> parseParams(String paramsString) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String param : paramsString.split(",")) {
            int separator = param.indexOf(':');
            if (separator < 1) {
                return Optional.empty();
            }
            params.put(param.substring(0, separator), param.substring(separator + 1));
        }
        return Optional.of(params);
    }

    private static Map<String, AllocationPolicyConfigDefinition> combine(List<AllocationPolicyConfigDefinition> policyDefinitions) {
        Map<String, AllocationPolicyConfigDefinition> combined = new LinkedHashMap<>();
        COMMON_DEFINITIONS.forEach(definition -> combined.put(definition.getName(), definition));
        policyDefinitions.forEach(definition -> combined.put(definition.getName(), definition));
        return combined;
    }

    private Map<String, AllocationPolicyConfigDefinition> applyOverrides(
            Map<String, AllocationPolicyConfigDefinition> definitions, Map<String, Object> overrides) {
        overrides.forEach((name, value) -> {
            AllocationPolicyConfigDefinition definition = definitions.get(name);
            if (definition == null) {
                throw new IllegalArgumentException(getName() + " has no config named " + name);
            }
            if (definition.isParameterised()) {
                throw new IllegalArgumentException(getName() + " config " + name
                        + " is parameterised, so its default cannot be overridden");
            }
            try {
                definitions.put(name, definition.withDefaultValue(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(getName() + " config " + name + " has invalid default override "
                        + value + ": " + e.getMessage(), e);
            }
        });
        return definitions;
    }
}
