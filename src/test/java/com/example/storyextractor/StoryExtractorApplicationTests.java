package com.example.storyextractor;

import com.example.storyextractor.application.service.StoryExtractionService;
import com.example.storyextractor.config.StoryExtractorProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class StoryExtractorApplicationTests {

    @Autowired
    private StoryExtractionService extractionService;

    @Autowired
    private StoryExtractorProperties properties;

	/**
	 * Ensures the application context loads and binds the export settings.
	 */
	@Test
	void contextLoads() {
		assertThat(extractionService).isNotNull();
		assertThat(properties.export().storiesFileName()).isEqualTo("stories");
		assertThat(properties.export().csvByteOrderMark()).isTrue();
	}

}
