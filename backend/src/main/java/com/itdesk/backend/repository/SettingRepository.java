package com.itdesk.backend.repository;

import com.itdesk.backend.domain.Setting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettingRepository extends JpaRepository<Setting, UUID> {

    Optional<Setting> findByKey(String key);

    List<Setting> findAllByOrderByKeyAsc();

    List<Setting> findByCategoryOrderByKeyAsc(String category);
}
