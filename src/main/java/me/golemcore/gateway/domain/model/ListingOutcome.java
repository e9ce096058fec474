/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.domain.model;

import java.util.List;

/**
 * Either the listed items or the reason the listing failed. A failed listing
 * degrades to an empty list for the caller.
 */
public record ListingOutcome<T>(List<T> items, String error) {

    public static <T> ListingOutcome<T> success(List<T> items) {
        return new ListingOutcome<>(List.copyOf(items), null);
    }

    public static <T> ListingOutcome<T> failure(String error) {
        return new ListingOutcome<>(List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
