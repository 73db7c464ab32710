package com.servealert.unit.delivery;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static com.servealert.support.TestAlerts.clockAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.servealert.config.ServeAlertProperties;
import com.servealert.delivery.DeviceNotificationMessage;
import com.servealert.delivery.StompNotificationGateway;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.exception.NotificationDeliveryException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

class StompNotificationGatewayTest {

    private static final String DESTINATION = "/topic/notifications";

    @Mock
    private SimpMessagingTemplate simpMessagingTemplate;

    private ServeAlertProperties properties;
    private StompNotificationGateway gateway;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new ServeAlertProperties();
        gateway = new StompNotificationGateway(simpMessagingTemplate, properties, clockAt(BASE_TIME));
    }

    private DeviceNotificationMessage sentMessage() {
        ArgumentCaptor<DeviceNotificationMessage> message = ArgumentCaptor.forClass(DeviceNotificationMessage.class);
        verify(simpMessagingTemplate).convertAndSend(eq(DESTINATION), message.capture());
        return message.getValue();
    }

    @Test
    @DisplayName("presenting pushes the payload with a fresh handle")
    void present() {
        NotificationPayload payload = NotificationPayload.builder().title("⚠️ HIGH: Ticket backlog").build();

        String handle = gateway.scheduleLocal(payload);

        DeviceNotificationMessage message = sentMessage();
        assertThat(handle).isNotBlank();
        assertThat(message.getKind()).isEqualTo(DeviceNotificationMessage.Kind.PRESENT);
        assertThat(message.getHandle()).isEqualTo(handle);
        assertThat(message.getPayload()).isSameAs(payload);
        assertThat(message.getSentAt()).isEqualTo(BASE_TIME);
    }

    @Test
    @DisplayName("a broker failure becomes a delivery exception")
    void brokerFailure() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(simpMessagingTemplate)
                .convertAndSend(anyString(), any(Object.class));

        assertThatThrownBy(() -> gateway.scheduleLocal(NotificationPayload.builder().title("t").build()))
                .isInstanceOf(NotificationDeliveryException.class);
    }

    @Test
    @DisplayName("cancel carries the handle")
    void cancel() {
        gateway.cancel("h-1");

        DeviceNotificationMessage message = sentMessage();
        assertThat(message.getKind()).isEqualTo(DeviceNotificationMessage.Kind.CANCEL);
        assertThat(message.getHandle()).isEqualTo("h-1");
    }

    @Test
    @DisplayName("cancel all has no handle")
    void cancelAll() {
        gateway.cancelAll();

        assertThat(sentMessage().getKind()).isEqualTo(DeviceNotificationMessage.Kind.CANCEL_ALL);
    }

    @Test
    @DisplayName("categories are pushed for the client to register")
    void categories() {
        gateway.registerCategories(List.of());

        assertThat(sentMessage().getKind()).isEqualTo(DeviceNotificationMessage.Kind.REGISTER_CATEGORIES);
    }

    @Test
    @DisplayName("permission is undetermined until requested, then follows configuration")
    void permission() {
        assertThat(gateway.checkPermission()).isEqualTo(PermissionStatus.UNDETERMINED);

        assertThat(gateway.requestPermission()).isEqualTo(PermissionStatus.GRANTED);
        assertThat(gateway.checkPermission()).isEqualTo(PermissionStatus.GRANTED);

        properties.getNotifications().setAutoGrantPermission(false);
        assertThat(gateway.requestPermission()).isEqualTo(PermissionStatus.DENIED);
    }
}
