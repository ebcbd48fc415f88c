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

/**
 * How an allocation policy currently applies to requests. This changes only when the policy's configuration does.
 */
public enum PolicyMode {
    /**
     * The policy is skipped.
     */
    INACTIVE,
    /**
     * The policy's decisions are applied.
     */
    ENFORCED,
    /**
     * The policy's decisions are recorded, but every request is admitted.
     */
    DRY_RUN;

    /**
     * Derives the mode from the policy's flags.
     *
     * @param  active   whether the policy is active
     * @param  enforced whether the policy is enforced
     * @return          the mode
     */
    public static PolicyMode from(boolean active, boolean enforced) {
        if (!active) {
            return INACTIVE;
        }
        return enforced ? ENFORCED : DRY_RUN;
    }
}
