package dev.shortlist;

import dev.shortlist.job.JobTracker;
import dev.shortlist.report.ReportRenderer;
import dev.shortlist.retrieval.RetrievalService;
import dev.shortlist.service.ShortlistJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ShortlistJobService jobService;

  @Autowired
  private JobTracker jobTracker;

  @Autowired
  private RetrievalService retrievalService;

  @Autowired
  private ReportRenderer reportRenderer;

  @Test
  void contextLoads() {
    assertThat(jobService).isNotNull();
    assertThat(jobTracker).isNotNull();
    assertThat(reportRenderer).isNotNull();
    assertThat(retrievalService.isReady()).isFalse();
  }
}
