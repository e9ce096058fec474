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
package me.golemcore.gateway.domain.exception;

import me.golemcore.gateway.domain.model.CapabilityKind;

/**
 * Access passed the first check but was gone by the time the request was about
 * to be forwarded.
 */
public class PermissionRevokedException extends GatewayException {

    private static final long serialVersionUID = 1L;

    public PermissionRevokedException(CapabilityKind kind, String name) {
        super(GatewayErrorKind.PERMISSION_REVOKED,
                "Access revoked: permission for " + kind.getWireName() + " '" + name + "' was withdrawn");
    }
}
