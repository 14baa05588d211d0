package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.dto.AcknowledgeAlertRequest;
import com.seveninterprise.healthalert.dto.BulkAlertRequest;
import com.seveninterprise.healthalert.dto.BulkAlertResponse;
import com.seveninterprise.healthalert.dto.CreateAlertRequest;
import com.seveninterprise.healthalert.dto.DeliveryReceiptRequest;
import com.seveninterprise.healthalert.dto.DeliveryTypeStatistics;
import com.seveninterprise.healthalert.dto.EscalateAlertRequest;
import com.seveninterprise.healthalert.dto.ResolveAlertRequest;
import com.seveninterprise.healthalert.dto.UpdateAlertStatusRequest;
import com.seveninterprise.healthalert.exceptions.AlertAccessDeniedException;
import com.seveninterprise.healthalert.exceptions.AlertClosedException;
import com.seveninterprise.healthalert.exceptions.AlertNotFoundException;
import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.exceptions.NoRecipientsException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.AlertResolution;
import com.seveninterprise.healthalert.model.AlertStatusChange;
import com.seveninterprise.healthalert.model.EscalationRule;
import com.seveninterprise.healthalert.model.EscalationTimer;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import com.seveninterprise.healthalert.repositories.AlertStatusChangeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    private static final Instant BASE = Instant.parse("2024-06-01T04:30:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(BASE, ZoneOffset.UTC);
    private static final String ALERT_ID = "ALT-SYS-0010";

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private AlertStatusChangeRepository statusChangeRepository;

    @Mock
    private AlertIdGenerator idGenerator;

    @Mock
    private AlertLockManager lockManager;

    @Mock
    private IRecipientResolver recipientResolver;

    @Mock
    private IEscalationService escalationService;

    @Mock
    private IDeliveryDispatcher dispatcher;

    @Mock
    private TransactionTemplate transactionTemplate;

    private AlertService alertService;

    private Alert alert;

    @BeforeEach
    void setUp() {
        alertService = new AlertService(alertRepository, statusChangeRepository, idGenerator, lockManager,
            recipientResolver, escalationService, dispatcher, transactionTemplate, Clock.fixed(BASE, ZoneOffset.UTC));

        alert = new Alert();
        alert.setAlertId(ALERT_ID);
        alert.setAlertType(Alert.AlertType.DISEASE_OUTBREAK_NOTIFICATION);
        alert.setLevel(Alert.AlertLevel.WARNING);
        alert.setPriority(Alert.AlertPriority.MEDIUM);
        alert.setTriggeredAt(NOW.minusMinutes(30));
        alert.setCreatedAt(NOW.minusMinutes(30));
        alert.setChannels(Arrays.asList(Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.EMAIL));
        for (int i = 1; i <= 10; i++) {
            AlertRecipient recipient = new AlertRecipient("u" + i, alert.getChannels(), NOW.minusMinutes(30));
            alert.addRecipient(recipient);
            for (Alert.DeliveryChannel channel : recipient.getChannels()) {
                recipient.deliveryStatusFor(channel, NOW.minusMinutes(30));
            }
        }
        alert.addEscalationTimer(new EscalationTimer(EscalationTimer.INITIAL_ESCALATION, NOW.minusMinutes(30),
            NOW.plusMinutes(30), EscalationRule.EscalationAction.ESCALATE_TO_SUPERVISOR));
        alert.recomputeDeliveryStatistics();

        lenient().when(lockManager.executeInLock(anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
        lenient().when(transactionTemplate.execute(any()))
            .thenAnswer(invocation -> ((TransactionCallback<?>) invocation.getArgument(0)).doInTransaction(null));
        lenient().when(alertRepository.findByAlertId(ALERT_ID)).thenReturn(Optional.of(alert));
        lenient().when(alertRepository.save(any(Alert.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private CreateAlertRequest createRequest() {
        CreateAlertRequest request = new CreateAlertRequest();
        request.setAlertType(Alert.AlertType.WATER_CONTAMINATION_WARNING);
        request.setTitle("  Contaminação no poço comunitário ");
        request.setMessage("Não consumir água do poço da vila V1");
        request.setLevel(Alert.AlertLevel.CRITICAL);
        CreateAlertRequest.TargetAudience audience = new CreateAlertRequest.TargetAudience(Alert.AudienceType.INDIVIDUAL_USERS);
        audience.setUserIds(Arrays.asList("u1", "u2"));
        request.setTargetAudience(audience);
        return request;
    }

    // ============================================
    // CRIAÇÃO
    // ============================================

    @Test
    void testCreateAlert_ShouldResolveRecipientsRegisterTimersAndDispatch() {
        // Given
        CreateAlertRequest request = createRequest();
        when(idGenerator.nextAlertId()).thenReturn("ALT-SYS-0001");
        when(recipientResolver.resolveRecipients(any(Alert.class), eq(NOW))).thenAnswer(invocation -> {
            Alert target = invocation.getArgument(0);
            return Arrays.asList(
                new AlertRecipient("u1", target.getChannels(), NOW),
                new AlertRecipient("u2", target.getChannels(), NOW));
        });

        // When
        Alert created = alertService.createAlert(request, "asha-7");

        // Then
        assertEquals("ALT-SYS-0001", created.getAlertId());
        assertEquals("Contaminação no poço comunitário", created.getTitle());
        assertEquals(Alert.AlertStatus.ACTIVE, created.getStatus());
        assertEquals(Alert.AlertPriority.URGENT, created.getPriority());
        assertEquals(AlertService.DEFAULT_CHANNELS, created.getChannels());
        assertEquals(2, created.getDeliveryStatistics().getTotalRecipients());
        assertEquals(NOW.plusDays(Alert.DEFAULT_ARCHIVE_AFTER_DAYS), created.getExpiresAt());
        assertEquals("asha-7", created.getCreatedBy());

        List<AlertStatusChange> history = created.getStatusHistory();
        assertEquals(1, history.size());
        assertNull(history.get(0).getFromStatus());
        assertEquals(Alert.AlertStatus.ACTIVE, history.get(0).getToStatus());

        verify(dispatcher).queueDeliveries(created, NOW);
        verify(escalationService).registerTimers(created, NOW);
        verify(escalationService).evaluateSeverityRules(created, NOW);
        verify(dispatcher).dispatchAsync("ALT-SYS-0001");
    }

    @Test
    void testCreateAlert_WhenScheduledInFuture_ShouldNotDispatchImmediately() {
        // Given
        CreateAlertRequest request = createRequest();
        request.getDelivery().setScheduledFor(NOW.plusHours(3));
        when(idGenerator.nextAlertId()).thenReturn("ALT-SYS-0002");
        when(recipientResolver.resolveRecipients(any(Alert.class), eq(NOW)))
            .thenReturn(Collections.singletonList(new AlertRecipient("u1", AlertService.DEFAULT_CHANNELS, NOW)));

        // When
        Alert created = alertService.createAlert(request, "official-1");

        // Then
        assertEquals(NOW.plusHours(3), created.getScheduledFor());
        verify(dispatcher, never()).dispatchAsync(anyString());
    }

    @Test
    void testCreateAlert_WhenNoRecipientsResolved_ShouldPropagateAndPersistNothing() {
        // Given
        when(idGenerator.nextAlertId()).thenReturn("ALT-SYS-0003");
        when(recipientResolver.resolveRecipients(any(Alert.class), any()))
            .thenThrow(new NoRecipientsException(Alert.AudienceType.INDIVIDUAL_USERS));

        // When & Then
        assertThrows(NoRecipientsException.class, () -> alertService.createAlert(createRequest(), "official-1"));
        verify(alertRepository, never()).save(any(Alert.class));
        verify(dispatcher, never()).dispatchAsync(anyString());
    }

    @Test
    void testCreateAlert_WithInvalidInput_ShouldRejectBeforeTouchingStore() {
        CreateAlertRequest blankTitle = createRequest();
        blankTitle.setTitle("   ");
        assertThrows(AlertValidationException.class, () -> alertService.createAlert(blankTitle, "u"));

        CreateAlertRequest pastExpiry = createRequest();
        pastExpiry.getExpiration().setExpiresAt(NOW.minusMinutes(1));
        assertThrows(AlertValidationException.class, () -> alertService.createAlert(pastExpiry, "u"));

        CreateAlertRequest badRule = createRequest();
        badRule.getEscalationRules().add(new CreateAlertRequest.EscalationRuleRequest(
            EscalationRule.EscalationCondition.TIME_BASED, 1, null, new ArrayList<>()));
        assertThrows(AlertValidationException.class, () -> alertService.createAlert(badRule, "u"));

        CreateAlertRequest badZone = createRequest();
        badZone.getDelivery().setTimezone("Marte/Olympus");
        assertThrows(AlertValidationException.class, () -> alertService.createAlert(badZone, "u"));

        verify(transactionTemplate, never()).execute(any());
    }

    @Test
    void testCreateAlerts_ShouldReportPerItemResults() {
        // Given
        CreateAlertRequest invalid = createRequest();
        invalid.setMessage(null);
        when(idGenerator.nextAlertId()).thenReturn("ALT-SYS-0004", "ALT-SYS-0005");
        when(recipientResolver.resolveRecipients(any(Alert.class), any()))
            .thenAnswer(invocation -> Collections.singletonList(
                new AlertRecipient("u1", AlertService.DEFAULT_CHANNELS, NOW)));

        // When
        BulkAlertResponse response = alertService.createAlerts(
            new BulkAlertRequest(Arrays.asList(createRequest(), invalid, createRequest()), false), "official-1");

        // Then
        assertEquals(2, response.getSuccessCount());
        assertEquals(1, response.getFailureCount());
        assertFalse(response.getResults().get(1).isSuccess());
        assertEquals("ALT-SYS-0005", response.getResults().get(2).getAlertId());
    }

    @Test
    void testCreateAlerts_WithStopOnFirstFailure_ShouldStopProcessing() {
        // Given
        CreateAlertRequest invalid = createRequest();
        invalid.setTitle(null);

        // When
        BulkAlertResponse response = alertService.createAlerts(
            new BulkAlertRequest(Arrays.asList(invalid, createRequest()), true), "official-1");

        // Then
        assertEquals(1, response.getResults().size());
        assertEquals(1, response.getFailureCount());
    }

    @Test
    void testCreateAlerts_WithEmptyList_ShouldThrowValidation() {
        assertThrows(AlertValidationException.class,
            () -> alertService.createAlerts(new BulkAlertRequest(new ArrayList<>(), false), "official-1"));
    }

    // ============================================
    // RECONHECIMENTO
    // ============================================

    @Test
    void testAcknowledge_ShouldFlipToAcknowledgedOnlyWhenHalfOfRecipientsAcknowledged() {
        // Given: limiar = ceil(10 × 0.5) = 5
        assertEquals(5, alert.getAcknowledgmentThreshold());

        // When
        for (int i = 1; i <= 4; i++) {
            alertService.acknowledge(ALERT_ID, "u" + i, null);
            assertEquals(Alert.AlertStatus.ACTIVE, alert.getStatus());
        }
        Alert acknowledged = alertService.acknowledge(ALERT_ID, "u5", new AcknowledgeAlertRequest(
            Collections.singletonList("Equipe enviada"), "Ciente"));

        // Then
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, acknowledged.getStatus());
        assertEquals(50, acknowledged.getResponseRate());
        AlertStatusChange change = acknowledged.getStatusHistory().get(acknowledged.getStatusHistory().size() - 1);
        assertEquals(Alert.AlertStatus.ACTIVE, change.getFromStatus());
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, change.getToStatus());
        assertEquals("u5", change.getChangedBy());
        assertEquals(1, acknowledged.getStatusHistory().size());
    }

    @Test
    void testAcknowledge_WhenSameUserRepeats_ShouldCountOnce() {
        // When
        for (int i = 0; i < 6; i++) {
            alertService.acknowledge(ALERT_ID, "u1", null);
        }

        // Then
        assertEquals(6, alert.getAcknowledgments().size());
        assertEquals(1, alert.getAcknowledgedUserIds().size());
        assertEquals(Alert.AlertStatus.ACTIVE, alert.getStatus());
        assertEquals(10, alert.getResponseRate());
    }

    @Test
    void testAcknowledge_AfterThreshold_ShouldKeepAcknowledgedAndRecordAck() {
        // Given
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);

        // When
        Alert result = alertService.acknowledge(ALERT_ID, "u9", null);

        // Then
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, result.getStatus());
        assertEquals(1, result.getAcknowledgments().size());
        assertTrue(result.getStatusHistory().isEmpty());
    }

    @Test
    void testAcknowledge_WhenUserIsNotRecipient_ShouldThrowAccessDenied() {
        assertThrows(AlertAccessDeniedException.class,
            () -> alertService.acknowledge(ALERT_ID, "intruso", null));
        assertTrue(alert.getAcknowledgments().isEmpty());
    }

    @Test
    void testAcknowledge_WhenAlertResolved_ShouldThrowClosed() {
        alert.setStatus(Alert.AlertStatus.RESOLVED);

        AlertClosedException exception = assertThrows(AlertClosedException.class,
            () -> alertService.acknowledge(ALERT_ID, "u1", null));
        assertEquals(Alert.AlertStatus.RESOLVED, exception.getStatus());
    }

    @Test
    void testAcknowledge_WhenAlertMissing_ShouldThrowNotFound() {
        when(alertRepository.findByAlertId("ALT-SYS-9999")).thenReturn(Optional.empty());

        assertThrows(AlertNotFoundException.class,
            () -> alertService.acknowledge("ALT-SYS-9999", "u1", null));
    }

    // ============================================
    // RESOLUÇÃO, CANCELAMENTO E STATUS
    // ============================================

    @Test
    void testResolve_ShouldRecordResolutionAndDeactivateTimers() {
        // Given
        ResolveAlertRequest request = new ResolveAlertRequest("Poço tratado", AlertResolution.ResolutionType.ESCALATION_RESOLVED);
        request.setActionsTaken(Arrays.asList("Cloração", "Coleta de amostra"));
        request.setFollowUpRequired(true);

        // When
        Alert resolved = alertService.resolve(ALERT_ID, "official-1", request);

        // Then
        assertEquals(Alert.AlertStatus.RESOLVED, resolved.getStatus());
        assertEquals("official-1", resolved.getResolution().getResolvedBy());
        assertEquals(NOW, resolved.getResolution().getResolvedAt());
        assertEquals(AlertResolution.ResolutionType.ESCALATION_RESOLVED, resolved.getResolution().getResolutionType());
        assertTrue(resolved.getResolution().isFollowUpRequired());
        assertEquals(2, resolved.getResolutionActions().size());
        assertTrue(resolved.getEscalationTimers().stream().noneMatch(EscalationTimer::isActive));
    }

    @Test
    void testResolve_WhenAlreadyResolved_ShouldThrowClosed() {
        alert.setStatus(Alert.AlertStatus.RESOLVED);

        assertThrows(AlertClosedException.class, () -> alertService.resolve(ALERT_ID, "official-1", null));
    }

    @Test
    void testResolve_FromExpired_ShouldBeAllowed() {
        alert.setStatus(Alert.AlertStatus.EXPIRED);

        Alert resolved = alertService.resolve(ALERT_ID, "official-1", null);

        assertEquals(Alert.AlertStatus.RESOLVED, resolved.getStatus());
        assertEquals(AlertResolution.ResolutionType.MANUAL_INTERVENTION, resolved.getResolution().getResolutionType());
    }

    @Test
    void testCancel_ShouldDeactivateTimersAndRecordReason() {
        // When
        Alert cancelled = alertService.cancel(ALERT_ID, "admin-1", "Alarme falso");

        // Then
        assertEquals(Alert.AlertStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Alarme falso", cancelled.getStatusHistory().get(0).getReason());
        assertTrue(cancelled.getEscalationTimers().stream().noneMatch(EscalationTimer::isActive));
    }

    @Test
    void testCancel_WhenArchived_ShouldThrowClosed() {
        alert.setStatus(Alert.AlertStatus.ARCHIVED);

        assertThrows(AlertClosedException.class, () -> alertService.cancel(ALERT_ID, "admin-1", "x"));
    }

    @Test
    void testUpdateStatus_ToExpired_ShouldDeactivateTimers() {
        Alert expired = alertService.updateStatus(ALERT_ID, "admin-1",
            new UpdateAlertStatusRequest(Alert.AlertStatus.EXPIRED, "Janela encerrada"));

        assertEquals(Alert.AlertStatus.EXPIRED, expired.getStatus());
        assertTrue(expired.getEscalationTimers().stream().noneMatch(EscalationTimer::isActive));
    }

    @Test
    void testUpdateStatus_ToActive_ShouldBeRejected() {
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);

        assertThrows(AlertClosedException.class, () -> alertService.updateStatus(ALERT_ID, "admin-1",
            new UpdateAlertStatusRequest(Alert.AlertStatus.ACTIVE, null)));
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, alert.getStatus());
    }

    @Test
    void testUpdateStatus_ToResolved_ShouldDelegateToResolve() {
        Alert resolved = alertService.updateStatus(ALERT_ID, "admin-1",
            new UpdateAlertStatusRequest(Alert.AlertStatus.RESOLVED, "Controlado"));

        assertEquals(Alert.AlertStatus.RESOLVED, resolved.getStatus());
        assertEquals("Controlado", resolved.getResolution().getComments());
    }

    // ============================================
    // ESCALAÇÃO MANUAL E RECIBOS
    // ============================================

    @Test
    void testEscalate_ShouldUseSupervisorActionAndDispatch() {
        // When
        alertService.escalate(ALERT_ID, "official-1",
            new EscalateAlertRequest(Collections.singletonList("dmo-1"), null));

        // Then
        verify(escalationService).escalate(alert, EscalationRule.EscalationAction.ESCALATE_TO_SUPERVISOR,
            Collections.singletonList("dmo-1"), "official-1", "Escalação manual", NOW);
        verify(dispatcher).dispatchAsync(ALERT_ID);
    }

    @Test
    void testEscalate_WhenEscalationFails_ShouldNotDispatch() {
        // Given
        when(escalationService.escalate(any(), any(), anyList(), anyString(), anyString(), any()))
            .thenThrow(new AlertClosedException(ALERT_ID, Alert.AlertStatus.CANCELLED, "escalate"));

        // When & Then
        assertThrows(AlertClosedException.class, () -> alertService.escalate(ALERT_ID, "official-1",
            new EscalateAlertRequest(Collections.singletonList("dmo-1"), "Sem resposta")));
        verify(dispatcher, never()).dispatchAsync(anyString());
    }

    @Test
    void testRecordDeliveryReceipt_ShouldOverwriteStateAndRecomputeStatistics() {
        // When
        alertService.recordDeliveryReceipt(ALERT_ID, new DeliveryReceiptRequest(
            "u1", Alert.DeliveryChannel.SMS, RecipientDeliveryStatus.DeliveryState.DELIVERED, null));
        Alert result = alertService.recordDeliveryReceipt(ALERT_ID, new DeliveryReceiptRequest(
            "u2", Alert.DeliveryChannel.EMAIL, RecipientDeliveryStatus.DeliveryState.FAILED, "Caixa cheia"));

        // Then
        assertEquals(1, result.getDeliveryStatistics().getDelivered());
        assertEquals(1, result.getDeliveryStatistics().getFailed());
        assertEquals(10, result.getDeliveryStatistics().getTotalRecipients());
        RecipientDeliveryStatus failed = result.findRecipient("u2").orElseThrow()
            .findDeliveryStatus(Alert.DeliveryChannel.EMAIL).orElseThrow();
        assertEquals("Caixa cheia", failed.getErrorMessage());
    }

    @Test
    void testRecordDeliveryReceipt_WithPendingState_ShouldBeRejected() {
        assertThrows(AlertValidationException.class, () -> alertService.recordDeliveryReceipt(ALERT_ID,
            new DeliveryReceiptRequest("u1", Alert.DeliveryChannel.SMS, RecipientDeliveryStatus.DeliveryState.PENDING, null)));
    }

    @Test
    void testRecordDeliveryReceipt_ForUnknownRecipient_ShouldBeRejected() {
        assertThrows(AlertValidationException.class, () -> alertService.recordDeliveryReceipt(ALERT_ID,
            new DeliveryReceiptRequest("ninguem", Alert.DeliveryChannel.SMS, RecipientDeliveryStatus.DeliveryState.SENT, null)));
    }

    // ============================================
    // LEITURAS
    // ============================================

    @Test
    void testGetActiveAlertsForUser_ShouldOrderByPriorityThenNewest() {
        // Given
        Alert low = new Alert();
        low.setAlertId("ALT-SYS-0101");
        low.setPriority(Alert.AlertPriority.LOW);
        low.setCreatedAt(NOW.minusMinutes(1));
        Alert urgentOld = new Alert();
        urgentOld.setAlertId("ALT-SYS-0102");
        urgentOld.setPriority(Alert.AlertPriority.URGENT);
        urgentOld.setCreatedAt(NOW.minusHours(5));
        Alert urgentNew = new Alert();
        urgentNew.setAlertId("ALT-SYS-0103");
        urgentNew.setPriority(Alert.AlertPriority.URGENT);
        urgentNew.setCreatedAt(NOW.minusHours(1));
        when(alertRepository.findActiveForRecipient("u1", Alert.AlertStatus.ACTIVE, NOW))
            .thenReturn(Arrays.asList(low, urgentOld, urgentNew));

        // When
        List<Alert> result = alertService.getActiveAlertsForUser("u1");

        // Then
        assertEquals(Arrays.asList("ALT-SYS-0103", "ALT-SYS-0102", "ALT-SYS-0101"),
            Arrays.asList(result.get(0).getAlertId(), result.get(1).getAlertId(), result.get(2).getAlertId()));
    }

    @Test
    void testGetAlertsByTypeAndArea_WithoutArea_ShouldThrowValidation() {
        assertThrows(AlertValidationException.class,
            () -> alertService.getAlertsByTypeAndArea(Alert.AlertType.WEATHER_ALERT, null, null, null));
    }

    @Test
    void testGetDeliveryStatisticsByType_ShouldMapRowsSortedByVolume() {
        // Given
        List<Object[]> rows = Arrays.asList(
            new Object[]{Alert.AlertType.WEATHER_ALERT, 2L, 20L, 10L, 8L, 1L, 1L, 40.0},
            new Object[]{Alert.AlertType.HEALTH_EMERGENCY, 5L, 50L, 30L, 15L, 3L, 2L, null});
        when(alertRepository.aggregateDeliveryByType(NOW.minusDays(7))).thenReturn(rows);

        // When
        List<DeliveryTypeStatistics> statistics = alertService.getDeliveryStatisticsByType(7);

        // Then
        assertEquals(2, statistics.size());
        assertEquals(Alert.AlertType.HEALTH_EMERGENCY, statistics.get(0).getAlertType());
        assertEquals(5L, statistics.get(0).getTotalAlerts());
        assertNull(statistics.get(0).getAverageResponseRate());
    }

    @Test
    void testGetDeliveryStatisticsByType_WithNonPositiveDays_ShouldThrowValidation() {
        assertThrows(AlertValidationException.class, () -> alertService.getDeliveryStatisticsByType(0));
    }
}
