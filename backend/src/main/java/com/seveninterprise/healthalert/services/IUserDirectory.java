package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.UserRole;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Consulta ao diretório externo de usuários, papéis e áreas atribuídas
 */
public interface IUserDirectory {

    List<DirectoryUser> findActiveUsers();

    List<DirectoryUser> findActiveUsersByRoles(Collection<UserRole> roles);

    /**
     * Usuários conhecidos entre os ids informados, indexados por id
     */
    Map<String, DirectoryUser> findUsers(Collection<String> userIds);

    /**
     * Supervisores distintos dos usuários informados, na ordem dos usuários
     */
    List<String> findSupervisorIds(Collection<String> userIds);
}
