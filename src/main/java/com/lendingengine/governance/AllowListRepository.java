package com.lendingengine.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AllowListRepository extends JpaRepository<AllowListEntry, String> {

    List<AllowListEntry> findByKind(AllowListEntry.Kind kind);
}
