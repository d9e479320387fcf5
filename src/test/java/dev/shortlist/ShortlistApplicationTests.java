package dev.shortlist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShortlistApplicationTests {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldRunPipelineAndExitSuccessfully() {
    ShortlistApplication app = new ShortlistApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenReturn(3);

    app.run();

    verify(pipelineRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    ShortlistApplication app = new ShortlistApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Pipeline execution failed"));

    app.run();

    verify(exitManager).exit(1);
    verify(exitManager, never()).exit(0);
  }
}
