package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserTableRepository extends JpaRepository<UserTable, String> {

    List<UserTable> findByPurposeOrderByCreatedAtAsc(TablePurpose purpose);

    List<UserTable> findAllByOrderByCreatedAtAsc();
}
