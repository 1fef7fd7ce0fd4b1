package com.prakash.taskmate.controller;

import com.prakash.taskmate.exception.ProfileNotFoundException;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.service.UserProfileService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/profiles")
public class UserProfileController {

    private static final Logger log = LoggerFactory.getLogger(UserProfileController.class);

    private final UserProfileService userProfileService;

    @Autowired
    public UserProfileController(UserProfileService userProfileService) {
        this.userProfileService = userProfileService;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfile> getProfile(@PathVariable String userId) {
        log.debug("Received request to get profile of user: {}", userId);
        // ProfileNotFoundException maps to 404
        return ResponseEntity.ok(userProfileService.getProfile(userId));
    }

    /**
     * Creates or replaces a profile.
     *
     * @param userId  owner of the profile
     * @param profile work hours, break length and energy levels
     * @return the stored profile
     */
    @PutMapping("/{userId}")
    public ResponseEntity<UserProfile> saveProfile(@PathVariable String userId,
                                                   @Valid @RequestBody UserProfile profile) {
        log.info("Received request to save profile of user: {}", userId);
        try {
            return ResponseEntity.ok(userProfileService.saveProfile(userId, profile));
        } catch (Exception e) {
            log.error("Error saving profile of user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable String userId) {
        log.info("Received request to delete profile of user: {}", userId);
        try {
            userProfileService.deleteProfile(userId);
            return ResponseEntity.noContent().build();
        } catch (ProfileNotFoundException e) {
            log.warn("Cannot delete profile: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error deleting profile of user {}: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
