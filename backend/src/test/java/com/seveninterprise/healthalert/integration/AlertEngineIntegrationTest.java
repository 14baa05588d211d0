package com.seveninterprise.healthalert.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seveninterprise.healthalert.config.MutableClock;
import com.seveninterprise.healthalert.config.TestApplicationConfig;
import com.seveninterprise.healthalert.dto.CreateAlertRequest;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertStatusChange;
import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.UserRole;
import com.seveninterprise.healthalert.repositories.DirectoryUserRepository;
import com.seveninterprise.healthalert.repositories.EscalationTimerRepository;
import com.seveninterprise.healthalert.security.JwtProvider;
import com.seveninterprise.healthalert.services.AlertArchivalService;
import com.seveninterprise.healthalert.services.EscalationTimerService;
import com.seveninterprise.healthalert.services.IAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Fluxo completo do motor sobre H2: criação, entrega, reconhecimento,
 * escalação por timer e arquivamento.
 *
 * Sem @Transactional: a entrega roda em threads próprias e precisa
 * enxergar os dados confirmados.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestApplicationConfig.class)
class AlertEngineIntegrationTest {

    private static final Instant BASE = Instant.parse("2024-06-01T04:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private IAlertService alertService;

    @Autowired
    private EscalationTimerService escalationTimerService;

    @Autowired
    private AlertArchivalService archivalService;

    @Autowired
    private EscalationTimerRepository timerRepository;

    @Autowired
    private DirectoryUserRepository directoryUserRepository;

    @Autowired
    private JwtProvider jwtProvider;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setInstant(BASE);

        List<DirectoryUser> users = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            DirectoryUser user = new DirectoryUser("it-u" + i, UserRole.ASHA_WORKER);
            user.setVillageId("V-IT");
            user.setSupervisorId("it-sup");
            users.add(user);
        }
        users.add(new DirectoryUser("it-sup", UserRole.HEALTH_SUPERVISOR));
        directoryUserRepository.saveAll(users);
    }

    private CreateAlertRequest request(Alert.AlertLevel level, int recipients) {
        CreateAlertRequest request = new CreateAlertRequest();
        request.setAlertType(Alert.AlertType.DISEASE_OUTBREAK_NOTIFICATION);
        request.setTitle("Casos de diarreia aguda");
        request.setMessage("Reforçar orientação sobre água tratada na vila V-IT");
        request.setLevel(level);
        List<String> userIds = new ArrayList<>();
        for (int i = 1; i <= recipients; i++) {
            userIds.add("it-u" + i);
        }
        CreateAlertRequest.TargetAudience audience = new CreateAlertRequest.TargetAudience(Alert.AudienceType.INDIVIDUAL_USERS);
        audience.setUserIds(userIds);
        request.setTargetAudience(audience);
        return request;
    }

    private void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condição não atingida em 10s");
            }
            Thread.sleep(50);
        }
    }

    @Test
    void testEmergencyAlertWithoutAcknowledgment_ShouldEscalateOnceAfterTimer() throws Exception {
        // Given
        Alert alert = alertService.createAlert(request(Alert.AlertLevel.EMERGENCY, 4), "it-official");
        String alertId = alert.getAlertId();
        waitUntil(() -> alertService.getDeliveryStatistics(alertId).getSent() == 12);

        // When: 16 minutos sem reconhecimento
        clock.advance(Duration.ofMinutes(16));
        escalationTimerService.runEscalationSweep();
        escalationTimerService.runEscalationSweep();

        // Then
        List<EscalationChainEntry> chain = alertService.getEscalationChain(alertId);
        assertEquals(1, chain.size());
        assertEquals(1, chain.get(0).getEscalationLevel());
        assertTrue(chain.get(0).getRecipients().contains("it-sup"));

        Alert escalated = alertService.getAlert(alertId);
        assertEquals(Alert.AlertPriority.EMERGENCY, escalated.getPriority());
        assertEquals(Alert.AlertStatus.ACTIVE, escalated.getStatus());
        assertEquals(5, escalated.getDeliveryStatistics().getTotalRecipients());
        assertEquals(0, timerRepository.countByAlertAlertIdAndActiveTrue(alertId));
    }

    @Test
    void testAcknowledgments_ShouldFlipStatusOnFifthOfTenRecipients() {
        // Given
        Alert alert = alertService.createAlert(request(Alert.AlertLevel.WARNING, 10), "it-official");
        String alertId = alert.getAlertId();

        // When
        for (int i = 1; i <= 4; i++) {
            clock.advance(Duration.ofMinutes(1));
            Alert current = alertService.acknowledge(alertId, "it-u" + i, null);
            assertEquals(Alert.AlertStatus.ACTIVE, current.getStatus());
        }
        Alert acknowledged = alertService.acknowledge(alertId, "it-u5", null);

        // Then
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, acknowledged.getStatus());
        assertEquals(50, acknowledged.getResponseRate());

        // Timers vencidos de alertas reconhecidos não escalam
        clock.advance(Duration.ofHours(2));
        escalationTimerService.runEscalationSweep();
        assertTrue(alertService.getEscalationChain(alertId).isEmpty());
    }

    @Test
    void testExpiredAcknowledgedAlert_ShouldBeArchivedWithHistory() {
        // Given
        CreateAlertRequest request = request(Alert.AlertLevel.INFO, 1);
        request.getExpiration().setExpiresAt(LocalDateTime.now(clock).plusHours(1));
        Alert alert = alertService.createAlert(request, "it-official");
        String alertId = alert.getAlertId();
        alertService.acknowledge(alertId, "it-u1", null);

        // When
        clock.advance(Duration.ofHours(2));
        int archived = archivalService.archiveExpiredAlerts();

        // Then
        assertTrue(archived >= 1);
        assertEquals(Alert.AlertStatus.ARCHIVED, alertService.getAlert(alertId).getStatus());

        List<AlertStatusChange> history = alertService.getStatusHistory(alertId);
        AlertStatusChange last = history.get(history.size() - 1);
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, last.getFromStatus());
        assertEquals(Alert.AlertStatus.ARCHIVED, last.getToStatus());
        assertEquals(0, timerRepository.countByAlertAlertIdAndActiveTrue(alertId));
    }

    @Test
    void testArchivalSweep_ShouldOnlyArchiveExpiredAlertsWithAutoArchive() throws Exception {
        // Given: um alerta já arquivado em um ciclo anterior
        CreateAlertRequest previousRequest = request(Alert.AlertLevel.INFO, 1);
        previousRequest.getExpiration().setExpiresAt(LocalDateTime.now(clock).plusHours(1));
        String previousId = alertService.createAlert(previousRequest, "it-official").getAlertId();
        waitUntil(() -> alertService.getDeliveryStatistics(previousId).getSent() == 3);
        clock.advance(Duration.ofHours(2));
        archivalService.archiveExpiredAlerts();
        assertEquals(Alert.AlertStatus.ARCHIVED, alertService.getAlert(previousId).getStatus());
        int previousHistorySize = alertService.getStatusHistory(previousId).size();

        CreateAlertRequest eligibleRequest = request(Alert.AlertLevel.INFO, 1);
        eligibleRequest.getExpiration().setExpiresAt(LocalDateTime.now(clock).plusHours(1));
        String eligibleId = alertService.createAlert(eligibleRequest, "it-official").getAlertId();

        CreateAlertRequest manualRequest = request(Alert.AlertLevel.INFO, 1);
        manualRequest.getExpiration().setExpiresAt(LocalDateTime.now(clock).plusHours(1));
        manualRequest.getExpiration().setAutoArchive(false);
        String manualId = alertService.createAlert(manualRequest, "it-official").getAlertId();

        CreateAlertRequest futureRequest = request(Alert.AlertLevel.INFO, 1);
        futureRequest.getExpiration().setExpiresAt(LocalDateTime.now(clock).plusDays(10));
        String futureId = alertService.createAlert(futureRequest, "it-official").getAlertId();

        for (String alertId : List.of(eligibleId, manualId, futureId)) {
            waitUntil(() -> alertService.getDeliveryStatistics(alertId).getSent() == 3);
        }
        Alert.AlertStatus manualStatus = alertService.getAlert(manualId).getStatus();
        Alert.AlertStatus futureStatus = alertService.getAlert(futureId).getStatus();
        int manualHistorySize = alertService.getStatusHistory(manualId).size();
        int futureHistorySize = alertService.getStatusHistory(futureId).size();
        int eligibleHistorySize = alertService.getStatusHistory(eligibleId).size();

        // When
        clock.advance(Duration.ofHours(2));
        archivalService.archiveExpiredAlerts();

        // Then: só o alerta expirado com autoArchive muda
        assertEquals(Alert.AlertStatus.ARCHIVED, alertService.getAlert(eligibleId).getStatus());
        List<AlertStatusChange> eligibleHistory = alertService.getStatusHistory(eligibleId);
        assertEquals(eligibleHistorySize + 1, eligibleHistory.size());
        assertEquals(1, eligibleHistory.stream()
            .filter(change -> change.getToStatus() == Alert.AlertStatus.ARCHIVED)
            .count());

        assertEquals(manualStatus, alertService.getAlert(manualId).getStatus());
        assertEquals(manualHistorySize, alertService.getStatusHistory(manualId).size());

        assertEquals(futureStatus, alertService.getAlert(futureId).getStatus());
        assertEquals(futureHistorySize, alertService.getStatusHistory(futureId).size());

        assertEquals(Alert.AlertStatus.ARCHIVED, alertService.getAlert(previousId).getStatus());
        List<AlertStatusChange> previousHistory = alertService.getStatusHistory(previousId);
        assertEquals(previousHistorySize, previousHistory.size());
        assertEquals(1, previousHistory.stream()
            .filter(change -> change.getToStatus() == Alert.AlertStatus.ARCHIVED)
            .count());
    }

    @Test
    void testCreateAlertEndpoint_WithAshaWorkerToken_ShouldReturnCreated() throws Exception {
        String token = jwtProvider.generateToken("it-asha", "ASHA_WORKER");

        mockMvc.perform(post("/api/alerts")
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(Alert.AlertLevel.WARNING, 2))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.alertId").exists())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.createdBy").value("it-asha"));
    }

    @Test
    void testCreateAlertEndpoint_WithoutToken_ShouldReturnUnauthorized() throws Exception {
        mockMvc.perform(post("/api/alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(Alert.AlertLevel.WARNING, 2))))
            .andExpect(status().isUnauthorized());
    }
}
