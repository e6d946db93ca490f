package com.sprintsense.backend.repository;

import com.sprintsense.backend.model.WorkItem;
import com.sprintsense.backend.model.WorkItemStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WorkItemRepository extends MongoRepository<WorkItem, String> {

    List<WorkItem> findByTeamIdAndStatusNotOrderByPriorityDescCreatedAtAsc(String teamId, WorkItemStatus status);

    List<WorkItem> findByTeamIdAndStatusNotAndIdInOrderByPriorityDescCreatedAtAsc(
            String teamId, WorkItemStatus status, Collection<String> ids);
}
