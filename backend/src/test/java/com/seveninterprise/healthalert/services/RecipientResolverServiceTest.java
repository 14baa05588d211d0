package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.exceptions.NoRecipientsException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecipientResolverServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 10, 0);

    @Mock
    private IUserDirectory userDirectory;

    private RecipientResolverService recipientResolverService;

    private Alert alert;

    @BeforeEach
    void setUp() {
        recipientResolverService = new RecipientResolverService(userDirectory);

        alert = new Alert();
        alert.setAlertId("ALT-HEA-0001");
        alert.setLevel(Alert.AlertLevel.WARNING);
        alert.setChannels(Arrays.asList(Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.EMAIL));
    }

    private DirectoryUser user(String userId, UserRole role, String villageId) {
        DirectoryUser user = new DirectoryUser(userId, role);
        user.setVillageId(villageId);
        return user;
    }

    private List<String> userIds(List<AlertRecipient> recipients) {
        return recipients.stream().map(AlertRecipient::getUserId).collect(Collectors.toList());
    }

    @Test
    void testResolveRecipients_WithIndividualUsers_ShouldKeepOrderAndDropDuplicates() {
        // Given
        alert.setAudienceType(Alert.AudienceType.INDIVIDUAL_USERS);
        alert.setTargetUsers(Arrays.asList("u3", "u1", "u3", "u2"));

        DirectoryUser known = user("u1", UserRole.ASHA_WORKER, "V1");
        known.setPreferredChannels(Collections.singletonList(Alert.DeliveryChannel.EMAIL));
        known.setDoNotDisturbEnabled(true);
        known.setDoNotDisturbStart(LocalTime.of(22, 0));
        known.setDoNotDisturbEnd(LocalTime.of(6, 0));
        Map<String, DirectoryUser> directory = new HashMap<>();
        directory.put("u1", known);
        when(userDirectory.findUsers(anyCollection())).thenReturn(directory);

        // When
        List<AlertRecipient> recipients = recipientResolverService.resolveRecipients(alert, NOW);

        // Then
        assertEquals(Arrays.asList("u3", "u1", "u2"), userIds(recipients));
        AlertRecipient u1 = recipients.get(1);
        assertEquals(Alert.DeliveryChannel.EMAIL, u1.getPreferredChannel());
        assertTrue(u1.isDoNotDisturbEnabled());
        assertEquals(0, u1.getEscalationLevel());
        assertEquals(alert.getChannels(), recipients.get(0).getChannels());
    }

    @Test
    void testResolveRecipients_WithRolesAndAffectedArea_ShouldFilterByArea() {
        // Given
        alert.setAudienceType(Alert.AudienceType.ROLE_BASED_GROUPS);
        alert.getTargetRoles().add(UserRole.ASHA_WORKER);
        alert.getAffectedVillages().add("V1");

        when(userDirectory.findActiveUsersByRoles(anyCollection())).thenReturn(Arrays.asList(
            user("a1", UserRole.ASHA_WORKER, "V1"),
            user("a2", UserRole.ASHA_WORKER, "V2"),
            user("a3", UserRole.ASHA_WORKER, "V1")));

        // When
        List<AlertRecipient> recipients = recipientResolverService.resolveRecipients(alert, NOW);

        // Then
        assertEquals(Arrays.asList("a1", "a3"), userIds(recipients));
    }

    @Test
    void testResolveRecipients_WithGeographicRadius_ShouldUseDistance() {
        // Given
        alert.setAudienceType(Alert.AudienceType.GEOGRAPHIC_AREAS);
        alert.setCenterLatitude(26.1445);
        alert.setCenterLongitude(91.7362);
        alert.setRadiusKm(10.0);

        DirectoryUser near = user("near", UserRole.VOLUNTEER, null);
        near.setLatitude(26.1500);
        near.setLongitude(91.7400);
        DirectoryUser far = user("far", UserRole.VOLUNTEER, null);
        far.setLatitude(25.5788);
        far.setLongitude(91.8933);
        when(userDirectory.findActiveUsers()).thenReturn(Arrays.asList(near, far));

        // When
        List<AlertRecipient> recipients = recipientResolverService.resolveRecipients(alert, NOW);

        // Then
        assertEquals(Collections.singletonList("near"), userIds(recipients));
    }

    @Test
    void testResolveRecipients_WithCustomCriteria_ShouldMatchAllGivenCriteria() {
        // Given
        alert.setAudienceType(Alert.AudienceType.CUSTOM_LIST);
        alert.setCriteriaMinAge(18);
        alert.setCriteriaGender("female");
        alert.getCriteriaHealthConditions().add("pregnancy");

        DirectoryUser match = user("m1", UserRole.COMMUNITY_MEMBER, "V1");
        match.setAge(27);
        match.setGender("FEMALE");
        match.getHealthConditions().add("pregnancy");
        DirectoryUser tooYoung = user("m2", UserRole.COMMUNITY_MEMBER, "V1");
        tooYoung.setAge(16);
        tooYoung.setGender("female");
        tooYoung.getHealthConditions().add("pregnancy");
        DirectoryUser noCondition = user("m3", UserRole.COMMUNITY_MEMBER, "V1");
        noCondition.setAge(30);
        noCondition.setGender("female");
        when(userDirectory.findActiveUsers()).thenReturn(Arrays.asList(match, tooYoung, noCondition));

        // When
        List<AlertRecipient> recipients = recipientResolverService.resolveRecipients(alert, NOW);

        // Then
        assertEquals(Collections.singletonList("m1"), userIds(recipients));
    }

    @Test
    void testResolveRecipients_WhenNobodyMatches_ShouldThrowNoRecipients() {
        // Given
        alert.setAudienceType(Alert.AudienceType.ALL_USERS);
        when(userDirectory.findActiveUsers()).thenReturn(Collections.emptyList());

        // When & Then
        assertThrows(NoRecipientsException.class,
            () -> recipientResolverService.resolveRecipients(alert, NOW));
    }

    @Test
    void testResolveRecipients_WithGeographicAudienceWithoutArea_ShouldThrowValidation() {
        // Given
        alert.setAudienceType(Alert.AudienceType.GEOGRAPHIC_AREAS);

        // When & Then
        assertThrows(AlertValidationException.class,
            () -> recipientResolverService.resolveRecipients(alert, NOW));
    }

    @Test
    void testResolveEscalationTargets_ShouldSkipExistingRecipients() {
        // Given
        alert.addRecipient(new AlertRecipient("u1", alert.getChannels(), NOW));
        when(userDirectory.findUsers(anyCollection())).thenReturn(Collections.emptyMap());

        // When
        List<AlertRecipient> recipients = recipientResolverService.resolveEscalationTargets(
            alert, Arrays.asList("u1", "sup1", "sup1"), EscalationService.ESCALATION_CHANNELS, 2, NOW);

        // Then
        assertEquals(Collections.singletonList("sup1"), userIds(recipients));
        assertEquals(2, recipients.get(0).getEscalationLevel());
        assertEquals(EscalationService.ESCALATION_CHANNELS, recipients.get(0).getChannels());
    }

    @Test
    void testCalculateDistance_ShouldReturnKilometers() {
        // Guwahati -> Shillong, aproximadamente 64 km
        double distance = RecipientResolverService.calculateDistance(26.1445, 91.7362, 25.5788, 91.8933);

        assertTrue(distance > 60 && distance < 70, "Distância inesperada: " + distance);
    }
}
