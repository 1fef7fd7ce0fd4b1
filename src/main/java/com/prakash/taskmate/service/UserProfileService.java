package com.prakash.taskmate.service;

import com.prakash.taskmate.exception.ProfileNotFoundException;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private final UserProfileRepository userProfileRepository;

    @Autowired
    public UserProfileService(UserProfileRepository userProfileRepository) {
        this.userProfileRepository = userProfileRepository;
    }

    public UserProfile getProfile(String userId) {
        log.debug("Fetching profile for user: {}", userId);
        return userProfileRepository.findById(userId)
                .orElseThrow(() -> new ProfileNotFoundException("Profile not found for user: " + userId));
    }

    /**
     * Creates or replaces the stored profile of {@code userId}.
     */
    public UserProfile saveProfile(String userId, UserProfile profile) {
        profile.setUserId(userId);
        UserProfile saved = userProfileRepository.save(profile);
        log.info("Saved profile for user {} (work hours {} - {}).", userId,
                saved.getWorkHours() != null ? saved.getWorkHours().getStart() : "N/A",
                saved.getWorkHours() != null ? saved.getWorkHours().getEnd() : "N/A");
        return saved;
    }

    public void deleteProfile(String userId) {
        if (!userProfileRepository.existsById(userId)) {
            throw new ProfileNotFoundException("Profile not found for user: " + userId);
        }
        log.warn("Deleting profile for user: {}", userId);
        userProfileRepository.deleteById(userId);
    }

    /**
     * Picks the profile for a scheduling run: the inline one if given, else the
     * stored profile of {@code userId}, else the default profile.
     *
     * @throws ProfileNotFoundException if {@code userId} is given but has no stored profile
     */
    public UserProfile resolveProfile(UserProfile inlineProfile, String userId) {
        if (inlineProfile != null) {
            return inlineProfile;
        }
        if (userId != null && !userId.isBlank()) {
            return getProfile(userId);
        }
        log.debug("No profile supplied, using defaults.");
        return UserProfile.defaultProfile();
    }
}
