package com.example.shotforge_backend.repository;

import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.util.ProjectStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProjectRepository extends JpaRepository<Project, UUID> {
    Page<Project> findByOwnerOrderByCreatedAtDesc(Account owner, Pageable pageable);

    @Query("select p from Project p join fetch p.owner where p.id = :id")
    Optional<Project> findWithOwnerById(@Param("id") UUID id);

    @Query("select p from Project p join fetch p.owner where p.status = :status")
    List<Project> findByStatus(@Param("status") ProjectStatus status);
}
