package com.seveninterprise.healthalert.repositories;

import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Acesso somente leitura ao diretório externo de usuários
 */
@Repository
public interface DirectoryUserRepository extends JpaRepository<DirectoryUser, String> {

    List<DirectoryUser> findByActiveTrueOrderByUserIdAsc();

    List<DirectoryUser> findByActiveTrueAndRoleInOrderByUserIdAsc(Collection<UserRole> roles);

    List<DirectoryUser> findByUserIdIn(Collection<String> userIds);
}
