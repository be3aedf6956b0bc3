package io.github.drompincen.carebridge.persistence.repository;

import io.github.drompincen.carebridge.persistence.AbstractJpaIntegrationTest;
import io.github.drompincen.carebridge.persistence.entity.UserEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class UserRepositoryTest extends AbstractJpaIntegrationTest {

    @Autowired
    private UserRepository userRepository;

    @Test
    void findByEmailIgnoresCase() {
        userRepository.save(createUser("Nurse Joy", "Nurse.Joy@clinic.org", "7f1c"));

        assertThat(userRepository.findByEmailIgnoreCase("nurse.joy@CLINIC.org")).isPresent();
        assertThat(userRepository.findByEmailIgnoreCase("other@clinic.org")).isEmpty();
    }

    @Test
    void findByExternalUuid() {
        UserEntity saved = userRepository.save(createUser("Dr Who", "who@clinic.org", "uuid-42"));

        assertThat(userRepository.findByExternalUuid("uuid-42"))
                .get()
                .extracting(UserEntity::getId)
                .isEqualTo(saved.getId());
    }

    private UserEntity createUser(String name, String email, String externalUuid) {
        UserEntity user = new UserEntity();
        user.setName(name);
        user.setEmail(email);
        user.setExternalUuid(externalUuid);
        user.setRole("nurse");
        return user;
    }
}
