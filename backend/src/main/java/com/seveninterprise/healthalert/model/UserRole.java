package com.seveninterprise.healthalert.model;

/**
 * Papéis de usuário conhecidos pelo diretório externo
 *
 * Usados tanto para autorização das APIs (claim "role" do JWT)
 * quanto para a segmentação de público por papel.
 */
public enum UserRole {
    ADMIN,
    HEALTH_OFFICIAL,
    ASHA_WORKER,
    ANM,
    MEDICAL_OFFICER,
    HEALTH_SUPERVISOR,
    BLOCK_COORDINATOR,
    DISTRICT_COORDINATOR,
    VOLUNTEER,
    COMMUNITY_MEMBER
}
