package org.javai.snippets.session;

import java.util.Objects;
import org.javai.snippets.tabstop.TabstopOrder;

/**
 * Stops the active session once it jumps to the final tabstop.
 */
public class StopOnFinalTabstop implements SnippetSessionListener {

	private final SnippetEngine engine;

	public StopOnFinalTabstop(SnippetEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
	}

	@Override
	public void onJumpPost(JumpEvent event) {
		if (TabstopOrder.FINAL_ID.equals(event.to())) {
			engine.stop();
		}
	}
}
