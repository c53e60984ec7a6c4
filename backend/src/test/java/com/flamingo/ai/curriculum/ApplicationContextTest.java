package com.flamingo.ai.curriculum;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.curriculum.cli.OutlineCommand;
import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.service.importer.CurriculumImportService;
import com.flamingo.ai.curriculum.service.outline.OutlineParser;
import com.flamingo.ai.curriculum.service.sync.TopicTreeSynchronizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the application context loads against the in-memory database. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline and command beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(OutlineParser.class)).isNotNull();
    assertThat(applicationContext.getBean(TopicTreeSynchronizer.class)).isNotNull();
    assertThat(applicationContext.getBean(CurriculumImportService.class)).isNotNull();
    assertThat(applicationContext.getBean(OutlineCommand.class)).isNotNull();
  }

  @Test
  @DisplayName("Sync settings should bind from configuration")
  void syncSettingsShouldBind() {
    OutlineConfig config = applicationContext.getBean(OutlineConfig.class);
    assertThat(config.getSync().getMinNodeCount()).isEqualTo(3);
  }
}
