package ca.gc.cra.textpipe.application.error;

/**
 * Raised at pipeline construction when the stage chain is empty or the output type of one stage is not accepted by
 * the next. Never raised while processing a submission.
 *
 * @since 0.1.0
 */
public class PipelineConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public PipelineConfigurationException(String message) {
    super(message);
  }
}
