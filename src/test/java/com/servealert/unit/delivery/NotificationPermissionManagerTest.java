package com.servealert.unit.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.servealert.delivery.NotificationGateway;
import com.servealert.delivery.NotificationPermissionManager;
import com.servealert.domain.enums.NotificationAction;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.NotificationCategory;
import com.servealert.exception.StorageException;
import com.servealert.persistence.AlertStorageService;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationPermissionManagerTest {

    @Mock
    private NotificationGateway notificationGateway;

    @Mock
    private AlertStorageService alertStorageService;

    private NotificationPermissionManager manager;

    @BeforeEach
    void setUp() {
        manager = new NotificationPermissionManager(notificationGateway, alertStorageService);
    }

    @Nested
    @DisplayName("Requesting permission")
    class Request {

        @Test
        @DisplayName("an existing grant skips the prompt")
        void alreadyGranted() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.GRANTED);

            assertThat(manager.requestPermissions()).isEqualTo(PermissionStatus.GRANTED);
            verify(notificationGateway, never()).requestPermission();
        }

        @Test
        @DisplayName("a new grant is persisted and registers the action categories")
        void grant() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.DENIED);
            when(notificationGateway.requestPermission()).thenReturn(PermissionStatus.GRANTED);

            assertThat(manager.requestPermissions()).isEqualTo(PermissionStatus.GRANTED);

            verify(alertStorageService).savePermissionStatus(PermissionStatus.GRANTED);
            verify(notificationGateway).registerCategories(manager.getCategories());
            assertThat(manager.getCachedStatus()).isEqualTo(PermissionStatus.GRANTED);
        }

        @Test
        @DisplayName("a denial is remembered without registering categories")
        void denial() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.DENIED);
            when(notificationGateway.requestPermission()).thenReturn(PermissionStatus.DENIED);

            assertThat(manager.requestPermissions()).isEqualTo(PermissionStatus.DENIED);

            verify(alertStorageService).savePermissionStatus(PermissionStatus.DENIED);
            verify(notificationGateway, never()).registerCategories(anyList());
        }

        @Test
        @DisplayName("a failing prompt leaves the cached status as it was")
        void promptFails() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.DENIED);
            when(notificationGateway.requestPermission()).thenThrow(new IllegalStateException("no device"));

            assertThat(manager.requestPermissions()).isEqualTo(PermissionStatus.DENIED);
            verify(alertStorageService, never()).savePermissionStatus(any());
        }

        @Test
        @DisplayName("a storage failure does not lose the grant")
        void persistFails() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.DENIED);
            when(notificationGateway.requestPermission()).thenReturn(PermissionStatus.GRANTED);
            doThrow(new StorageException("redis down"))
                    .when(alertStorageService)
                    .savePermissionStatus(PermissionStatus.GRANTED);

            assertThat(manager.requestPermissions()).isEqualTo(PermissionStatus.GRANTED);
            assertThat(manager.getCachedStatus()).isEqualTo(PermissionStatus.GRANTED);
        }
    }

    @Nested
    @DisplayName("Checking permission")
    class Check {

        @Test
        @DisplayName("an undetermined device answer falls back to the stored status")
        void storedFallback() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.UNDETERMINED);
            when(alertStorageService.loadPermissionStatus()).thenReturn(Optional.of(PermissionStatus.GRANTED));

            assertThat(manager.checkPermissionStatus()).isEqualTo(PermissionStatus.GRANTED);
            assertThat(manager.isGranted()).isTrue();
        }

        @Test
        @DisplayName("nothing stored keeps the answer undetermined")
        void nothingStored() {
            when(notificationGateway.checkPermission()).thenReturn(PermissionStatus.UNDETERMINED);
            when(alertStorageService.loadPermissionStatus()).thenReturn(Optional.empty());

            assertThat(manager.checkPermissionStatus()).isEqualTo(PermissionStatus.UNDETERMINED);
        }

        @Test
        @DisplayName("a gateway failure reports undetermined")
        void gatewayFails() {
            when(notificationGateway.checkPermission()).thenThrow(new IllegalStateException("no device"));

            assertThat(manager.checkPermissionStatus()).isEqualTo(PermissionStatus.UNDETERMINED);
        }
    }

    @Test
    @DisplayName("categories map priorities to their quick actions")
    void categories() {
        assertThat(manager.getCategories())
                .extracting(NotificationCategory::identifier)
                .containsExactly("CRITICAL_ALERT", "HIGH_ALERT", "MEDIUM_ALERT");
        assertThat(manager.getCategories().get(0).actions())
                .containsExactly(NotificationAction.ACKNOWLEDGE, NotificationAction.VIEW_DETAILS);
    }

    @Test
    @DisplayName("denial and education messages are user-facing text")
    void messages() {
        assertThat(manager.handlePermissionDenial()).contains("view alerts in the app");
        assertThat(manager.permissionEducationMessage()).contains("critical restaurant alerts");
    }
}
