package org.openjobspec.middleware;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.openjobspec.middleware.testing.RecordingHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.openjobspec.middleware.RelativePosition.AFTER;
import static org.openjobspec.middleware.RelativePosition.BEFORE;

/**
 * End-to-end tests for {@link Stack}: step ordering, request creation, serialization of
 * parameters into a request, and deserialization of the raw response.
 */
@DisplayName("Stack")
class StackTest {

    /** Minimal request with headers, standing in for a transport request. */
    static final class Request {
        private final Map<String, String> headers = new LinkedHashMap<>();

        void header(String name, String value) {
            headers.put(name, value);
        }

        String header(String name) {
            return headers.get(name);
        }
    }

    record Input(String fooName, int barCount) {}

    @Nested
    @DisplayName("Serialize example")
    class SerializeExampleTests {

        @Test
        void headersFromParametersReachTerminalOnce() throws Exception {
            var stack = Stack.builder()
                    .id("serialize example")
                    .requestFactory(Request::new)
                    .build();

            stack.serialize().add(Middleware.of("set-foo", (ctx, in, next) -> {
                var req = in.request(Request.class);
                var input = in.parameters(Input.class);

                req.header("foo-name", input.fooName());
                req.header("bar-count", String.valueOf(input.barCount()));

                return next.handle(ctx, in);
            }), AFTER);

            var lines = new ArrayList<String>();
            var terminal = RecordingHandler.delegatingTo((ctx, in) -> {
                var req = (Request) in;
                lines.add("foo-name=" + req.header("foo-name"));
                lines.add("bar-count=" + req.header("bar-count"));
                return "200";
            });

            var out = stack.decorate(terminal).handle(Context.background(), new Input("abc", 123));

            assertEquals("200", out);
            assertEquals(List.of("foo-name=abc", "bar-count=123"), lines);
            terminal.assertInvokedOnce();
        }

        @Test
        void wrongParametersTypeFailsBeforeTerminal() {
            var stack = Stack.builder().id("op").requestFactory(Request::new).build();
            stack.serialize().add(Middleware.of("set-foo", (ctx, in, next) -> {
                in.parameters(Input.class);
                return next.handle(ctx, in);
            }), AFTER);
            var terminal = RecordingHandler.returning("ok");

            var ex = assertThrows(StackError.StackException.class,
                    () -> stack.decorate(terminal).handle(Context.background(), "not an input"));

            assertTrue(ex.isTypeMismatch());
            terminal.refuteInvoked();
        }
    }

    @Nested
    @DisplayName("Step ordering")
    class OrderingTests {

        @Test
        void stepsRunInFixedOrder() throws Exception {
            var events = new CopyOnWriteArrayList<String>();
            var stack = Stack.builder().id("op").requestFactory(Request::new).build();

            stack.deserialize().add(Middleware.of("d", (ctx, in, next) -> {
                events.add("deserialize");
                return next.handle(ctx, in);
            }), AFTER);
            stack.build().add(Middleware.of("b", (ctx, in, next) -> {
                events.add("build");
                return next.handle(ctx, in);
            }), AFTER);
            stack.initialize().add(Middleware.of("i", (ctx, in, next) -> {
                events.add("initialize");
                return next.handle(ctx, in);
            }), AFTER);
            stack.finalizeStep().add(Middleware.of("f", (ctx, in, next) -> {
                events.add("finalize");
                return next.handle(ctx, in);
            }), AFTER);
            stack.serialize().add(Middleware.of("s", (ctx, in, next) -> {
                events.add("serialize");
                return next.handle(ctx, in);
            }), AFTER);

            stack.decorate((ctx, in) -> {
                events.add("terminal");
                return "ok";
            }).handle(Context.background(), new Input("a", 1));

            assertEquals(List.of("initialize", "serialize", "build", "finalize", "deserialize", "terminal"),
                    events);
        }

        @Test
        void stepIdsAreDistinct() {
            var stack = Stack.builder().id("op").build();

            var ids = stack.steps().stream().map(Step::id).toList();

            assertEquals(List.of(InitializeStep.ID, SerializeStep.ID, BuildStep.ID,
                    FinalizeStep.ID, DeserializeStep.ID), ids);
        }

        @Test
        void initializeShortCircuitSkipsRequestCreation() throws Exception {
            var created = new AtomicInteger();
            var stack = Stack.builder().id("op").requestFactory(() -> {
                created.incrementAndGet();
                return new Request();
            }).build();
            stack.initialize().add(Middleware.of("cache",
                    (ctx, in, next) -> new InitializeStep.Output("cached")), AFTER);
            var terminal = RecordingHandler.returning("fresh");

            var out = stack.decorate(terminal).handle(Context.background(), new Input("a", 1));

            assertEquals("cached", out);
            assertEquals(0, created.get());
            terminal.refuteInvoked();
        }
    }

    @Nested
    @DisplayName("Requests and responses")
    class RequestResponseTests {

        @Test
        void requestFactoryRunsOncePerInvocation() throws Exception {
            var created = new AtomicInteger();
            var stack = Stack.builder().id("op").requestFactory(() -> {
                created.incrementAndGet();
                return new Request();
            }).build();
            var terminal = RecordingHandler.returning("ok");
            var handler = stack.decorate(terminal);

            handler.handle(Context.background(), new Input("a", 1));
            handler.handle(Context.background(), new Input("b", 2));

            assertEquals(2, created.get());
            terminal.assertInvokedTimes(2);
            assertNotSame(terminal.invocations().get(0).input(), terminal.invocations().get(1).input());
        }

        @Test
        void withoutFactoryTerminalReceivesNullRequest() throws Exception {
            var stack = Stack.builder().id("op").build();
            var terminal = RecordingHandler.returning("ok");

            stack.decorate(terminal).handle(Context.background(), new Input("a", 1));

            assertNull(terminal.lastInput());
        }

        @Test
        void deserializeMiddlewareTurnsRawResponseIntoResult() throws Exception {
            var stack = Stack.builder().id("op").requestFactory(Request::new).build();
            stack.deserialize().add(Middleware.of("parse", (ctx, in, next) -> {
                var out = next.handle(ctx, in);
                var raw = out.rawResponse(String.class);
                return out.withResult(Integer.parseInt(raw));
            }), AFTER);

            var out = stack.decorate((ctx, in) -> "204").handle(Context.background(), new Input("a", 1));

            assertEquals(204, out);
        }

        @Test
        void withoutDeserializerRawResponseIsReturned() throws Exception {
            var stack = Stack.builder().id("op").requestFactory(Request::new).build();

            var out = stack.decorate((ctx, in) -> "raw").handle(Context.background(), new Input("a", 1));

            assertEquals("raw", out);
        }

        @Test
        void buildMiddlewareSeesRequestPopulatedBySerialize() throws Exception {
            var stack = Stack.builder().id("op").requestFactory(Request::new).build();
            stack.serialize().add(Middleware.of("set-foo", (ctx, in, next) -> {
                in.request(Request.class).header("foo-name", in.parameters(Input.class).fooName());
                return next.handle(ctx, in);
            }), AFTER);
            stack.build().add(Middleware.of("echo", (ctx, in, next) -> {
                var req = in.request(Request.class);
                req.header("x-echo", req.header("foo-name"));
                return next.handle(ctx, in);
            }), AFTER);
            var terminal = RecordingHandler.returning("ok");

            stack.decorate(terminal).handle(Context.background(), new Input("abc", 1));

            assertEquals("abc", terminal.lastInput(Request.class).header("x-echo"));
        }
    }

    @Nested
    @DisplayName("Composition")
    class CompositionTests {

        @Test
        void stackIsItselfMiddleware() throws Exception {
            var events = new CopyOnWriteArrayList<String>();
            var stack = Stack.builder().id("inner").build();
            stack.build().add(Middleware.of("b", (ctx, in, next) -> {
                events.add("build");
                return next.handle(ctx, in);
            }), AFTER);
            Middleware<Object, Object> outer = Middleware.of("outer", (ctx, in, next) -> {
                events.add("outer");
                return next.handle(ctx, in);
            });

            var handler = Handlers.decorate((ctx, in) -> "ok", outer, stack);
            handler.handle(Context.background(), "params");

            assertEquals("inner", stack.id());
            assertEquals(List.of("outer", "build"), events);
        }

        @Test
        void describeListsMiddlewarePerStep() {
            var stack = Stack.builder().id("op").build();
            stack.build().add(Middleware.of("content-length", (ctx, in, next) -> next.handle(ctx, in)), AFTER);
            stack.build().add(Middleware.of("user-agent", (ctx, in, next) -> next.handle(ctx, in)), BEFORE);

            var text = stack.describe();

            assertTrue(text.startsWith("op stack step\n"));
            assertTrue(text.contains(BuildStep.ID + "\n\tuser-agent\n\tcontent-length\n"));
        }

        @Test
        void builderRequiresId() {
            var ex = assertThrows(NullPointerException.class, () -> Stack.builder().build());
            assertEquals("id must not be null", ex.getMessage());
        }
    }
}
