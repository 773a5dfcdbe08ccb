package tech.yump.cendre.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.cendre.audit.AuditBackend;
import tech.yump.cendre.audit.FileAuditBackend;
import tech.yump.cendre.audit.LogAuditBackend;

import static org.assertj.core.api.Assertions.assertThat;

class AuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withUserConfiguration(AuditConfiguration.class);

    @Test
    void defaultsToLogBackend() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AuditBackend.class);
            assertThat(context.getBean(AuditBackend.class)).isInstanceOf(LogAuditBackend.class);
        });
    }

    @Test
    void fileBackendIsSelectedByProperty() {
        contextRunner
                .withPropertyValues("cendre.audit.backend=file")
                .run(context -> {
                    assertThat(context).hasSingleBean(AuditBackend.class);
                    assertThat(context.getBean(AuditBackend.class)).isInstanceOf(FileAuditBackend.class);
                });
    }
}
