package com.jreinhal.colloquy.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void plainMessagesPassThrough() {
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("Activity type is required"))
                .isEqualTo("Activity type is required");
    }

    @Test
    void internalDetailsAreMasked() {
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage(null)).isEqualTo("Invalid request");
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("  ")).isEqualTo("Invalid request");
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("cannot read /etc/colloquy.yaml")).isEqualTo("Invalid request");
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("NullPointerException in step")).isEqualTo("Invalid request");
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("failed in com.jreinhal.colloquy.Foo")).isEqualTo("Invalid request");
        assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201))).isEqualTo("Invalid request");
    }

    @Test
    void configurationErrorsAreBadRequests() {
        ResponseEntity<Map<String, Object>> response =
                this.handler.handleBadRequest(new DialogConfigurationException("Dialog id is required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error", "Dialog id is required").containsKey("timestamp");
    }
}
