package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.Credential;

public interface CredentialRepository extends JpaRepository<Credential, Long> {
}
