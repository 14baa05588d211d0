package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.UserRole;
import com.seveninterprise.healthalert.repositories.DirectoryUserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diretório de usuários sobre a tabela directory_users
 */
@Service
@Transactional(readOnly = true)
public class JpaUserDirectory implements IUserDirectory {

    private final DirectoryUserRepository directoryUserRepository;

    public JpaUserDirectory(DirectoryUserRepository directoryUserRepository) {
        this.directoryUserRepository = directoryUserRepository;
    }

    @Override
    public List<DirectoryUser> findActiveUsers() {
        return directoryUserRepository.findByActiveTrueOrderByUserIdAsc();
    }

    @Override
    public List<DirectoryUser> findActiveUsersByRoles(Collection<UserRole> roles) {
        if (roles == null || roles.isEmpty()) {
            return new ArrayList<>();
        }
        return directoryUserRepository.findByActiveTrueAndRoleInOrderByUserIdAsc(roles);
    }

    @Override
    public Map<String, DirectoryUser> findUsers(Collection<String> userIds) {
        Map<String, DirectoryUser> users = new LinkedHashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return users;
        }
        for (DirectoryUser user : directoryUserRepository.findByUserIdIn(userIds)) {
            users.put(user.getUserId(), user);
        }
        return users;
    }

    @Override
    public List<String> findSupervisorIds(Collection<String> userIds) {
        Map<String, DirectoryUser> users = findUsers(userIds);
        Set<String> supervisors = new LinkedHashSet<>();
        for (String userId : userIds) {
            DirectoryUser user = users.get(userId);
            if (user != null && user.getSupervisorId() != null && !user.getSupervisorId().isBlank()) {
                supervisors.add(user.getSupervisorId());
            }
        }
        return new ArrayList<>(supervisors);
    }
}
