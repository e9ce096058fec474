package me.golemcore.gateway.adapter.inbound.web;

import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.GatewayErrorKind;
import me.golemcore.gateway.domain.exception.PermissionRevokedException;
import me.golemcore.gateway.domain.model.CapabilityKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapEveryErrorKindToHttpStatus() {
        assertEquals(HttpStatus.UNAUTHORIZED, GlobalExceptionHandler.statusOf(GatewayErrorKind.AUTHENTICATION_FAILURE));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusOf(GatewayErrorKind.PERMISSION_DENIED));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusOf(GatewayErrorKind.PERMISSION_REVOKED));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(GatewayErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, GlobalExceptionHandler.statusOf(GatewayErrorKind.UPSTREAM_TIMEOUT));
        assertEquals(HttpStatus.BAD_GATEWAY, GlobalExceptionHandler.statusOf(GatewayErrorKind.UPSTREAM_EXECUTION_ERROR));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusOf(GatewayErrorKind.VALIDATION_ERROR));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                GlobalExceptionHandler.statusOf(GatewayErrorKind.CONFIGURATION_ERROR));
    }

    @Test
    void shouldRenderGatewayException() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleGateway(new PermissionRevokedException(CapabilityKind.TOOL, "read_file")).block();

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertEquals("permission_revoked", response.getBody().getKind());
        assertEquals(403, response.getBody().getStatus());
    }

    @Test
    void shouldRenderResponseStatusAndHideGenericFailures() {
        ResponseEntity<ApiErrorResponse> unauthorized = handler
                .handleResponseStatus(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated"))
                .block();
        ResponseEntity<ApiErrorResponse> generic = handler.handleGeneric(new IllegalStateException("db password"))
                .block();

        assertEquals("Not authenticated", unauthorized.getBody().getMessage());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, generic.getStatusCode());
        assertEquals("Internal server error", generic.getBody().getMessage());
    }
}
