package io.github.drompincen.carebridge.runtime.identity;

import io.github.drompincen.carebridge.persistence.entity.UserEntity;
import io.github.drompincen.carebridge.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps an actor reference found in a document (numeric id, email or external UUID) to a user id.
 * An unknown actor is not an error; the row is simply stored without attribution.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final UserRepository userRepository;

    public IdentityResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Optional<Long> resolve(String actorRef) {
        if (actorRef == null || actorRef.isBlank()) {
            return Optional.empty();
        }
        String ref = actorRef.trim();

        if (isNumeric(ref)) {
            try {
                long id = Long.parseLong(ref);
                return id > 0 ? Optional.of(id) : Optional.empty();
            } catch (NumberFormatException e) {
                log.debug("Actor id {} out of range", ref);
                return Optional.empty();
            }
        }

        Optional<UserEntity> user = ref.contains("@")
                ? userRepository.findByEmailIgnoreCase(ref)
                : userRepository.findByExternalUuid(ref);
        if (user.isEmpty()) {
            log.debug("No user matches actor reference {}", ref);
        }
        return user.map(UserEntity::getId);
    }

    private static boolean isNumeric(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) return false;
        }
        return true;
    }
}
