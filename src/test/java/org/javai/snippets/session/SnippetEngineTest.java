package org.javai.snippets.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.Level;
import org.javai.snippets.Snippet;
import org.javai.snippets.document.InMemoryDocument;
import org.javai.snippets.document.TextRange;
import org.javai.snippets.parse.SnippetSyntaxException;
import org.javai.snippets.tabstop.Direction;
import org.javai.snippets.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class SnippetEngineTest {

	@Mock
	private SnippetSessionListener listener;

	private final InMemoryDocument document = new InMemoryDocument();
	private final SnippetEngine engine = new SnippetEngine(document, document);

	SnippetEngineTest() {
		MockitoAnnotations.openMocks(this);
		engine.addListener(listener);
	}

	@Nested
	@DisplayName("Expansion")
	class Expansion {

		@Test
		void replacesTypedPrefix() {
			InMemoryDocument typed = new InMemoryDocument("fori");
			typed.setCursor(4);
			SnippetEngine prefixed = new SnippetEngine(typed, typed);

			Optional<SnippetSession> session = prefixed.expand(Snippet.of("for (${1:i}) {}"), new TextRange(0, 4));

			assertThat(session).isPresent();
			assertThat(typed.text()).isEqualTo("for (i) {}");
			assertThat(typed.cursor()).isEqualTo(5);
		}

		@Test
		void plainSnippetStartsNoSession() {
			Optional<SnippetSession> session = engine.expand(Snippet.of("Hello $0 world"));

			assertThat(session).isEmpty();
			assertThat(document.text()).isEqualTo("Hello  world");
			assertThat(document.cursor()).isEqualTo(6);
			assertThat(engine.activeSession()).isEmpty();
			verify(listener, times(0)).onSessionStart(any());
		}

		@Test
		void lookupValuesAreInserted() {
			engine.expand(Snippet.of("${name} says $1").withLookup(Map.of("name", "Ada")));

			assertThat(document.text()).isEqualTo("Ada says ");
		}

		@Test
		void finalTabstopWithChoicesStartsSession() {
			Optional<SnippetSession> session = engine.expand(Snippet.of("answer: ${0|yes,no|}"));

			assertThat(session).isPresent();
			assertThat(document.text()).isEqualTo("answer: ");
			assertThat(document.cursor()).isEqualTo(8);
			verify(listener).onChoiceOffer(new ChoiceOffer("0", List.of("yes", "no")));
		}

		@Test
		void failedStartRestoresParentSession() {
			InMemoryDocument readOnly = spy(new InMemoryDocument());
			SnippetEngine nesting = new SnippetEngine(readOnly, readOnly);
			SnippetSession outer = nesting.expand(Snippet.of("f(${1:x}) $0")).orElseThrow();
			doThrow(new IllegalStateException("read-only")).when(readOnly).insertText(anyInt(), anyString());

			assertThatThrownBy(() -> nesting.expand(Snippet.of("[${1:y}]")))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("read-only");

			assertThat(nesting.sessions()).containsExactly(outer);
			assertThat(outer.state()).isEqualTo(SnippetSession.State.ACTIVE);
			assertThat(readOnly.text()).isEqualTo("f(x) ");
		}

		@Test
		void syntaxErrorLeavesDocumentUntouched() {
			InMemoryDocument existing = new InMemoryDocument("keep");
			SnippetEngine strict = new SnippetEngine(existing, existing);

			assertThatThrownBy(() -> strict.expand(Snippet.of("${1:oops")))
					.isInstanceOf(SnippetSyntaxException.class);
			assertThat(existing.text()).isEqualTo("keep");
			assertThat(strict.activeSession()).isEmpty();
		}

		@Test
		void jumpWithoutSessionFails() {
			assertThatThrownBy(() -> engine.jump(Direction.NEXT))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("No active snippet session");
		}
	}

	@Nested
	@DisplayName("Nested sessions")
	class NestedSessions {

		@Test
		void innerSessionSuspendsOuterUntilStopped() {
			SnippetSession outer = engine.expand(Snippet.of("f(${1:x}) $0")).orElseThrow();
			document.deleteText(2, 3);
			engine.onDocumentChanged();

			SnippetSession inner = engine.expand(Snippet.of("[${1:y}]")).orElseThrow();

			assertThat(engine.sessions()).containsExactly(outer, inner);
			assertThat(outer.state()).isEqualTo(SnippetSession.State.SUSPENDED);
			assertThat(document.text()).isEqualTo("f([y]) ");

			engine.stop();

			assertThat(inner.state()).isEqualTo(SnippetSession.State.STOPPED);
			assertThat(engine.activeSession()).contains(outer);
			assertThat(outer.state()).isEqualTo(SnippetSession.State.ACTIVE);
			TextRange range = outer.tabstopRanges("1").get(0);
			assertThat(document.readText(range.start(), range.end())).isEqualTo("[y]");
			verify(listener).onSessionResume(any());
		}

		@Test
		void stopAllEmptiesTheStack() {
			engine.expand(Snippet.of("a(${1:x})"));
			engine.expand(Snippet.of("b(${1:y})"));

			engine.stopAll();

			assertThat(engine.sessions()).isEmpty();
			assertThat(document.anchorCount()).isZero();
			verify(listener, times(2)).onSessionStop(any());
		}
	}

	@Test
	void corruptedSessionIsStoppedAndReported() {
		engine.expand(Snippet.of("${1:a} ${2:bb} c"));
		document.deleteText(1, 5);

		try (LogCaptorAppender captor = LogCaptorAppender.create(SnippetEngine.class, Level.WARN)) {
			engine.onDocumentChanged();

			assertThat(captor.messagesAt(Level.WARN))
					.anyMatch(m -> m.startsWith("Snippet session is corrupted and will be stopped"));
		}
		assertThat(engine.activeSession()).isEmpty();
		assertThat(document.anchorCount()).isZero();
		verify(listener, times(1)).onSessionCorruption(any(SessionCorruptionException.class));
	}

	@Test
	void failingListenerDoesNotBreakSession() {
		doThrow(new IllegalStateException("boom")).when(listener).onSessionStart(any());

		try (LogCaptorAppender captor = LogCaptorAppender.create(SessionEvents.class, Level.WARN)) {
			Optional<SnippetSession> session = engine.expand(Snippet.of("${1:a} $2"));

			assertThat(session).isPresent();
			assertThat(captor.messagesAt(Level.WARN)).contains("Listener threw an exception on session-start");
		}
	}

	@Test
	void listenerCallingBackIntoEngineDoesNotBlockDocumentChanges() throws InterruptedException {
		CountDownLatch jumping = new CountDownLatch(1);
		engine.addListener(new StopOnFinalTabstop(engine));
		engine.addListener(new SnippetSessionListener() {
			@Override
			public void onJumpPre(JumpEvent event) {
				jumping.countDown();
				pause(200);
			}
		});
		SnippetSession session = engine.expand(Snippet.of("${1:a} $0")).orElseThrow();

		Thread jumper = new Thread(() -> session.jump(Direction.NEXT));
		Thread editor = new Thread(() -> {
			try {
				if (jumping.await(5, TimeUnit.SECONDS)) {
					engine.onDocumentChanged();
				}
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
		});
		jumper.setDaemon(true);
		editor.setDaemon(true);
		jumper.start();
		editor.start();
		jumper.join(5000);
		editor.join(5000);

		assertThat(jumper.isAlive()).isFalse();
		assertThat(editor.isAlive()).isFalse();
		assertThat(session.state()).isEqualTo(SnippetSession.State.STOPPED);
		assertThat(engine.activeSession()).isEmpty();
	}

	private static void pause(long millis) {
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
	}

	@Test
	void stopsWhenFinalTabstopIsReached() {
		engine.addListener(new StopOnFinalTabstop(engine));
		engine.expand(Snippet.of("${1:a} $0"));

		engine.jump(Direction.NEXT);

		assertThat(engine.activeSession()).isEmpty();
		verify(listener).onJumpPost(new JumpEvent("1", "0"));
		verify(listener).onSessionStop(any());
	}
}
