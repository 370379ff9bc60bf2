package com.yerin.syncwatch.repository;

import com.yerin.syncwatch.domain.DataChangeLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DataChangeLogRepository extends JpaRepository<DataChangeLog, Long> {
}
