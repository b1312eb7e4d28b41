package com.nl2sql.profiler.service.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.dto.profile.DatasetProfile;

import lombok.extern.slf4j.Slf4j;

/** Keeps the latest profile of each table in memory for the read endpoints. */
@Slf4j
@Service
public class ProfileRegistry {

  private final Map<String, DatasetProfile> profiles = new ConcurrentHashMap<>();

  public void register(DatasetProfile profile) {
    DatasetProfile previous = profiles.put(profile.getTableName(), profile);
    if (previous != null) {
      log.info("Replaced profile of table {}", profile.getTableName());
    } else {
      log.info("Registered profile of table {}", profile.getTableName());
    }
  }

  public Optional<DatasetProfile> find(String tableName) {
    return Optional.ofNullable(profiles.get(tableName));
  }

  public List<String> tableNames() {
    return profiles.keySet().stream().sorted().toList();
  }

  public boolean remove(String tableName) {
    DatasetProfile removed = profiles.remove(tableName);
    if (removed == null) {
      log.warn("Profile not found for deletion: {}", tableName);
      return false;
    }
    log.info("Removed profile of table {}", tableName);
    return true;
  }
}
