package com.prakash.taskmate.repository;

import com.prakash.taskmate.model.UserProfile;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserProfileRepository extends MongoRepository<UserProfile, String> { // keyed by user id
}
