package com.example.realtime.service;

import com.example.realtime.domain.DevicePlatform;
import com.example.realtime.domain.DeviceToken;
import com.example.realtime.service.exception.ServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeviceTokenService Tests")
class DeviceTokenServiceTest {

    private static final String TOKEN = "ExponentPushToken[abc123]";

    @Mock
    private DeviceTokenRegistry deviceTokenRegistry;

    @InjectMocks
    private DeviceTokenService deviceTokenService;

    @Nested
    @DisplayName("Register Tests")
    class RegisterTests {

        @Test
        @DisplayName("Should store a trimmed token with its parsed platform")
        void shouldRegister() {
            // Given
            DeviceToken stored = DeviceToken.builder().id("t1").profileId("p1").token(TOKEN).platform(DevicePlatform.IOS).build();
            when(deviceTokenRegistry.register("p1", TOKEN, DevicePlatform.IOS, "iPhone")).thenReturn(stored);

            // When
            DeviceToken result = deviceTokenService.register("p1", "  " + TOKEN + " ", "IOS", " iPhone ");

            // Then
            assertThat(result).isSameAs(stored);
        }

        @Test
        @DisplayName("Losing a concurrent insert of the same token should end as an update")
        void shouldRetryAfterConcurrentInsert() {
            // Given
            DeviceToken stored = DeviceToken.builder().id("t1").profileId("p1").token(TOKEN).platform(DevicePlatform.IOS).build();
            when(deviceTokenRegistry.register("p1", TOKEN, DevicePlatform.IOS, null))
                    .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"))
                    .thenReturn(stored);

            // When
            DeviceToken result = deviceTokenService.register("p1", TOKEN, "ios", null);

            // Then
            assertThat(result).isSameAs(stored);
            verify(deviceTokenRegistry, times(2)).register("p1", TOKEN, DevicePlatform.IOS, null);
        }

        @Test
        @DisplayName("Should refuse a token that is not an Expo push token")
        void shouldRejectInvalidToken() {
            assertThatThrownBy(() -> deviceTokenService.register("p1", "not-a-token", "ios", null))
                    .isInstanceOfSatisfying(ServiceException.class, ex -> {
                        assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                        assertThat(ex.getErrorCode()).isEqualTo("invalid_push_token");
                    });
            verifyNoInteractions(deviceTokenRegistry);
        }

        @Test
        @DisplayName("Should refuse an unknown device type")
        void shouldRejectUnknownPlatform() {
            assertThatThrownBy(() -> deviceTokenService.register("p1", TOKEN, "windows", null))
                    .isInstanceOfSatisfying(ServiceException.class,
                            ex -> assertThat(ex.getErrorCode()).isEqualTo("invalid_device_type"));
        }

        @Test
        @DisplayName("Should require the caller profile")
        void shouldRequireProfile() {
            assertThatThrownBy(() -> deviceTokenService.register(" ", TOKEN, "ios", null))
                    .isInstanceOfSatisfying(ServiceException.class,
                            ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED));
        }
    }

    @Nested
    @DisplayName("Unregister Tests")
    class UnregisterTests {

        @Test
        @DisplayName("Should delete a token owned by the caller")
        void shouldDeleteOwnToken() {
            // Given
            when(deviceTokenRegistry.findByToken(TOKEN))
                    .thenReturn(Optional.of(DeviceToken.builder().id("t1").profileId("p1").token(TOKEN).build()));

            // When
            deviceTokenService.unregister("p1", TOKEN);

            // Then
            verify(deviceTokenRegistry).delete(TOKEN);
        }

        @Test
        @DisplayName("Should treat an unknown token as already removed")
        void unknownTokenIsNoOp() {
            // Given
            when(deviceTokenRegistry.findByToken(TOKEN)).thenReturn(Optional.empty());

            // When
            deviceTokenService.unregister("p1", TOKEN);

            // Then
            verify(deviceTokenRegistry, never()).delete(anyString());
        }

        @Test
        @DisplayName("Should not delete a token that belongs to another profile")
        void shouldRefuseForeignToken() {
            // Given
            when(deviceTokenRegistry.findByToken(TOKEN))
                    .thenReturn(Optional.of(DeviceToken.builder().id("t1").profileId("p2").token(TOKEN).build()));

            // When / Then
            assertThatThrownBy(() -> deviceTokenService.unregister("p1", TOKEN))
                    .isInstanceOfSatisfying(ServiceException.class, ex -> {
                        assertThat(ex.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
                        assertThat(ex.getErrorCode()).isEqualTo("token_not_owned");
                    });
            verify(deviceTokenRegistry, never()).delete(any());
        }

        @Test
        @DisplayName("Logout should remove every token of the caller")
        void shouldRemoveAllForProfile() {
            // Given
            when(deviceTokenRegistry.deleteAllForProfile("p1")).thenReturn(3);

            // When / Then
            assertThat(deviceTokenService.unregisterAll("p1", "p1")).isEqualTo(3);
        }

        @Test
        @DisplayName("Logout for another profile should be forbidden")
        void shouldRefuseOtherProfile() {
            assertThatThrownBy(() -> deviceTokenService.unregisterAll("p1", "p2"))
                    .isInstanceOfSatisfying(ServiceException.class,
                            ex -> assertThat(ex.getErrorCode()).isEqualTo("profile_mismatch"));
            verifyNoInteractions(deviceTokenRegistry);
        }
    }
}
