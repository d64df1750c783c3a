package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.InstalledModule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface InstalledModuleRepository extends JpaRepository<InstalledModule, String> {
}
