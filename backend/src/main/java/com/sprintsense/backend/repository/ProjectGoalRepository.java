package com.sprintsense.backend.repository;

import com.sprintsense.backend.model.ProjectGoal;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectGoalRepository extends MongoRepository<ProjectGoal, String> {

    List<ProjectGoal> findByTeamIdOrderByPriorityWeightDescCreatedAtAsc(String teamId);
}
