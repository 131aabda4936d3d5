package com.shlawgathon.drawcheck.backend;

import com.shlawgathon.drawcheck.backend.model.ValidationReport;
import com.shlawgathon.drawcheck.backend.repository.ValidationReportRepository;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.lifecycle.Startables;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.Optional;

/**
 * Base class for E2E tests with TestContainers MongoDB and Redis. The
 * containers are shared by every test class so the cached Spring context
 * keeps pointing at live ports.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseE2ETest {

    static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    static final GenericContainer<?> redisContainer = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        Startables.deepStart(mongoDBContainer, redisContainer).join();
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "drawcheck-test");
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
    }

    /**
     * Poll until the stored report reaches COMPLETE or FAILED.
     */
    protected static ValidationReport awaitFinished(ValidationReportRepository repository, String requestId)
            throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
        while (System.nanoTime() < deadline) {
            Optional<ValidationReport> report = repository.findById(requestId);
            if (report.isPresent() && report.get().getStatus().isTerminal()) {
                return report.get();
            }
            Thread.sleep(100);
        }
        throw new AssertionError("Validation " + requestId + " did not finish in time");
    }
}
