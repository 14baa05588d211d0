package com.seveninterprise.healthalert.model;

import jakarta.persistence.*;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Usuário do diretório externo (somente leitura para o motor de alertas)
 *
 * A tabela é mantida pelos módulos de cadastro; aqui só é consultada pelo
 * resolvedor de destinatários e pela busca de supervisores.
 */
@Entity
@Table(name = "directory_users", indexes = {
    @Index(name = "idx_directory_role", columnList = "user_role, active")
})
public class DirectoryUser {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "full_name")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_role", nullable = false)
    private UserRole role;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "district_id")
    private String districtId;

    @Column(name = "block_id")
    private String blockId;

    @Column(name = "village_id")
    private String villageId;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "age")
    private Integer age;

    @Column(name = "gender")
    private String gender;

    @Column(name = "location")
    private String location;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "directory_user_conditions", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "health_condition")
    private Set<String> healthConditions = new LinkedHashSet<>();

    @Column(name = "supervisor_id")
    private String supervisorId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "directory_user_channels", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "list_index")
    @Enumerated(EnumType.STRING)
    @Column(name = "channel")
    private List<Alert.DeliveryChannel> preferredChannels = new ArrayList<>();

    @Column(name = "dnd_enabled", nullable = false)
    private boolean doNotDisturbEnabled;

    @Column(name = "dnd_start_time")
    private LocalTime doNotDisturbStart;

    @Column(name = "dnd_end_time")
    private LocalTime doNotDisturbEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_frequency")
    private AlertRecipient.DeliveryFrequency deliveryFrequency;

    public DirectoryUser() {}

    public DirectoryUser(String userId, UserRole role) {
        this.userId = userId;
        this.role = role;
    }

    // Getters and Setters
    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getDistrictId() {
        return districtId;
    }

    public void setDistrictId(String districtId) {
        this.districtId = districtId;
    }

    public String getBlockId() {
        return blockId;
    }

    public void setBlockId(String blockId) {
        this.blockId = blockId;
    }

    public String getVillageId() {
        return villageId;
    }

    public void setVillageId(String villageId) {
        this.villageId = villageId;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public String getGender() {
        return gender;
    }

    public void setGender(String gender) {
        this.gender = gender;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public Set<String> getHealthConditions() {
        return healthConditions;
    }

    public void setHealthConditions(Set<String> healthConditions) {
        this.healthConditions = healthConditions;
    }

    public String getSupervisorId() {
        return supervisorId;
    }

    public void setSupervisorId(String supervisorId) {
        this.supervisorId = supervisorId;
    }

    public List<Alert.DeliveryChannel> getPreferredChannels() {
        return preferredChannels;
    }

    public void setPreferredChannels(List<Alert.DeliveryChannel> preferredChannels) {
        this.preferredChannels = preferredChannels;
    }

    public boolean isDoNotDisturbEnabled() {
        return doNotDisturbEnabled;
    }

    public void setDoNotDisturbEnabled(boolean doNotDisturbEnabled) {
        this.doNotDisturbEnabled = doNotDisturbEnabled;
    }

    public LocalTime getDoNotDisturbStart() {
        return doNotDisturbStart;
    }

    public void setDoNotDisturbStart(LocalTime doNotDisturbStart) {
        this.doNotDisturbStart = doNotDisturbStart;
    }

    public LocalTime getDoNotDisturbEnd() {
        return doNotDisturbEnd;
    }

    public void setDoNotDisturbEnd(LocalTime doNotDisturbEnd) {
        this.doNotDisturbEnd = doNotDisturbEnd;
    }

    public AlertRecipient.DeliveryFrequency getDeliveryFrequency() {
        return deliveryFrequency;
    }

    public void setDeliveryFrequency(AlertRecipient.DeliveryFrequency deliveryFrequency) {
        this.deliveryFrequency = deliveryFrequency;
    }
}
