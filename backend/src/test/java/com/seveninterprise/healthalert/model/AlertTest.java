package com.seveninterprise.healthalert.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 10, 0);
    private static final List<Alert.DeliveryChannel> SMS_EMAIL =
        Arrays.asList(Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.EMAIL);

    private Alert alert;

    @BeforeEach
    void setUp() {
        alert = new Alert();
        alert.setAlertId("ALT-SYS-0001");
        alert.setLevel(Alert.AlertLevel.CRITICAL);
        alert.setPriority(Alert.AlertPriority.URGENT);
        alert.setTriggeredAt(NOW);
    }

    private AlertRecipient addRecipient(String userId) {
        AlertRecipient recipient = new AlertRecipient(userId, SMS_EMAIL, NOW);
        alert.addRecipient(recipient);
        for (Alert.DeliveryChannel channel : recipient.getChannels()) {
            recipient.deliveryStatusFor(channel, NOW);
        }
        return recipient;
    }

    @Test
    void testRecomputeDeliveryStatistics_ShouldMatchRecipientCountAndStates() {
        // Given
        AlertRecipient first = addRecipient("u1");
        AlertRecipient second = addRecipient("u2");
        addRecipient("u3");
        first.deliveryStatusFor(Alert.DeliveryChannel.SMS, NOW).setState(RecipientDeliveryStatus.DeliveryState.SENT);
        first.deliveryStatusFor(Alert.DeliveryChannel.EMAIL, NOW).setState(RecipientDeliveryStatus.DeliveryState.DELIVERED);
        second.deliveryStatusFor(Alert.DeliveryChannel.SMS, NOW).setState(RecipientDeliveryStatus.DeliveryState.FAILED);
        second.deliveryStatusFor(Alert.DeliveryChannel.EMAIL, NOW).setState(RecipientDeliveryStatus.DeliveryState.READ);

        // When
        alert.recomputeDeliveryStatistics();

        // Then
        DeliveryStatistics statistics = alert.getDeliveryStatistics();
        assertEquals(alert.getRecipients().size(), statistics.getTotalRecipients());
        assertEquals(1, statistics.getSent());
        assertEquals(1, statistics.getDelivered());
        assertEquals(1, statistics.getRead());
        assertEquals(1, statistics.getFailed());
    }

    @Test
    void testRecomputeDeliveryStatistics_WithDuplicateAcknowledgments_ShouldCountUserOnce() {
        // Given
        addRecipient("u1");
        addRecipient("u2");
        alert.addAcknowledgment(new AlertAcknowledgment("u1", NOW.plusMinutes(4)));
        alert.addAcknowledgment(new AlertAcknowledgment("u1", NOW.plusMinutes(9)));

        // When
        alert.recomputeDeliveryStatistics();

        // Then
        assertEquals(1, alert.getAcknowledgedUserIds().size());
        assertEquals(50, alert.getResponseRate());
        assertEquals(4.0, alert.getAverageResponseMinutes());
    }

    @Test
    void testAcknowledgmentThreshold_ShouldBeHalfOfRecipientsRoundedUp() {
        for (int i = 1; i <= 3; i++) {
            addRecipient("u" + i);
        }
        assertEquals(2, alert.getAcknowledgmentThreshold());

        for (int i = 4; i <= 10; i++) {
            addRecipient("u" + i);
        }
        assertEquals(5, alert.getAcknowledgmentThreshold());
    }

    @Test
    void testPriorityNext_ShouldBeCappedAtEmergency() {
        assertEquals(Alert.AlertPriority.HIGH, Alert.AlertPriority.MEDIUM.next());
        assertEquals(Alert.AlertPriority.EMERGENCY, Alert.AlertPriority.URGENT.next());
        assertEquals(Alert.AlertPriority.EMERGENCY, Alert.AlertPriority.EMERGENCY.next());
        assertEquals(Alert.AlertLevel.EMERGENCY, Alert.AlertLevel.EMERGENCY.next());
    }

    @Test
    void testEscalationDelay_ShouldDecreaseWithSeverity() {
        assertEquals(240, Alert.AlertLevel.INFO.getEscalationDelayMinutes());
        assertEquals(60, Alert.AlertLevel.WARNING.getEscalationDelayMinutes());
        assertEquals(30, Alert.AlertLevel.CRITICAL.getEscalationDelayMinutes());
        assertEquals(15, Alert.AlertLevel.EMERGENCY.getEscalationDelayMinutes());
    }

    @Test
    void testDeactivateTimers_ShouldReturnOnlyActiveCount() {
        // Given
        EscalationTimer active = new EscalationTimer("a", NOW, NOW.plusMinutes(30), EscalationRule.EscalationAction.ADD_RECIPIENTS);
        EscalationTimer fired = new EscalationTimer("b", NOW, NOW.plusMinutes(10), EscalationRule.EscalationAction.ADD_RECIPIENTS);
        fired.setActive(false);
        alert.addEscalationTimer(active);
        alert.addEscalationTimer(fired);

        // When
        int deactivated = alert.deactivateTimers();

        // Then
        assertEquals(1, deactivated);
        assertFalse(active.isActive());
    }

    @Test
    void testIsWithinDoNotDisturb_WithWindowCrossingMidnight() {
        AlertRecipient recipient = new AlertRecipient("u1", SMS_EMAIL, NOW);
        recipient.setDoNotDisturbEnabled(true);
        recipient.setDoNotDisturbStart(LocalTime.of(22, 0));
        recipient.setDoNotDisturbEnd(LocalTime.of(6, 0));

        assertTrue(recipient.isWithinDoNotDisturb(LocalTime.of(23, 30)));
        assertTrue(recipient.isWithinDoNotDisturb(LocalTime.of(2, 0)));
        assertFalse(recipient.isWithinDoNotDisturb(LocalTime.of(6, 0)));
        assertFalse(recipient.isWithinDoNotDisturb(LocalTime.of(12, 0)));
    }

    @Test
    void testIsWithinDoNotDisturb_WhenDisabled_ShouldReturnFalse() {
        AlertRecipient recipient = new AlertRecipient("u1", SMS_EMAIL, NOW);
        recipient.setDoNotDisturbStart(LocalTime.of(9, 0));
        recipient.setDoNotDisturbEnd(LocalTime.of(17, 0));

        assertFalse(recipient.isWithinDoNotDisturb(LocalTime.of(12, 0)));
    }

    @Test
    void testOrderedChannels_ShouldPutPreferredChannelFirst() {
        AlertRecipient recipient = new AlertRecipient("u1", SMS_EMAIL, NOW);
        recipient.setPreferredChannel(Alert.DeliveryChannel.EMAIL);

        assertEquals(Arrays.asList(Alert.DeliveryChannel.EMAIL, Alert.DeliveryChannel.SMS), recipient.orderedChannels());
    }

    @Test
    void testNextRecurrence_ShouldStopAfterEndDate() {
        alert.setRecurrenceInterval(Alert.RecurrenceInterval.DAILY);
        assertNull(alert.getNextRecurrenceAt());

        alert.setLastDispatchedAt(NOW);
        assertEquals(NOW.plusDays(1), alert.getNextRecurrenceAt());

        alert.setRecurrenceEndDate(NOW.plusHours(12));
        assertNull(alert.getNextRecurrenceAt());
    }
}
