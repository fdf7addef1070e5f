package com.wtwr.wardrobe.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtwr.common.ApiError;
import com.wtwr.common.ErrorKind;
import com.wtwr.observability.MetricFactory;
import com.wtwr.observability.SensitiveDataRedactor;
import com.wtwr.wardrobe.domain.DuplicateKeyException;
import com.wtwr.wardrobe.domain.MalformedIdentifierException;
import com.wtwr.wardrobe.domain.SchemaViolationException;
import io.jsonwebtoken.MalformedJwtException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("ErrorDispatcher")
class ErrorDispatcherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ErrorDispatcher dispatcher = new ErrorDispatcher(
            new ObjectMapper(), new MetricFactory(registry, "wardrobe-test"), new SensitiveDataRedactor());

    private final Logger logger = (Logger) LoggerFactory.getLogger(ErrorDispatcher.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("store schema violation becomes BadRequest with the default message")
        void schemaViolation() {
            ApiError error = dispatcher.resolve(new SchemaViolationException("name", "Path `name` is required."));

            assertThat(error.kind()).isEqualTo(ErrorKind.BAD_REQUEST);
            assertThat(error.message()).isEqualTo("Bad Request");
            assertThat(error.context()).containsEntry("field", "name");
        }

        @Test
        @DisplayName("malformed identifier becomes BadRequest")
        void malformedIdentifier() {
            assertThat(dispatcher.resolve(new MalformedIdentifierException("abc")).kind())
                    .isEqualTo(ErrorKind.BAD_REQUEST);
        }

        @Test
        @DisplayName("duplicate key becomes Conflict, also when wrapped")
        void duplicateKey() {
            ApiError error = dispatcher.resolve(new IllegalStateException("insert failed", new DuplicateKeyException("email")));

            assertThat(error.kind()).isEqualTo(ErrorKind.CONFLICT);
            assertThat(error.message()).isEqualTo("Conflict");
            assertThat(error.cause()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("credential library fault becomes Unauthorized")
        void jwtFault() {
            assertThat(dispatcher.resolve(new MalformedJwtException("bad segments")).kind())
                    .isEqualTo(ErrorKind.UNAUTHORIZED);
        }

        @Test
        @DisplayName("unreadable body becomes BadRequest")
        void unreadableBody() {
            var fault = new HttpMessageNotReadableException("JSON parse error", new MockHttpInputMessage(new byte[0]));

            ApiError error = dispatcher.resolve(fault);

            assertThat(error.kind()).isEqualTo(ErrorKind.BAD_REQUEST);
            assertThat(error.message()).isEqualTo(ErrorDispatcher.UNREADABLE_BODY);
        }

        @Test
        @DisplayName("missing route becomes NotFound")
        void missingRoute() {
            ApiError error = dispatcher.resolve(new NoResourceFoundException(HttpMethod.GET, "nope"));

            assertThat(error.kind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(error.message()).isEqualTo("Requested resource not found");
        }

        @Test
        @DisplayName("anything else becomes Internal")
        void unknownFault() {
            var fault = new IllegalStateException("connection to db:27017 refused");

            ApiError error = dispatcher.resolve(fault);

            assertThat(error.kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(error.cause()).isSameAs(fault);
        }

        @Test
        @DisplayName("self-referencing cause chain terminates")
        void cyclicCause() {
            var outer = new RuntimeException("outer");
            var inner = new RuntimeException("inner", outer);
            outer.initCause(inner);

            assertThat(dispatcher.resolve(outer).kind()).isEqualTo(ErrorKind.INTERNAL);
        }
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("uses the kind's status and the error's message")
        void statusAndMessage() {
            var response = dispatcher.dispatch(ApiError.notFound("Item not found"), new MockHttpServletRequest());

            assertThat(response.getStatusCode().value()).isEqualTo(404);
            assertThat(response.getBody()).isEqualTo(new ErrorResponse("Item not found"));
        }

        @Test
        @DisplayName("never leaks internal detail")
        void internalIsFixed() {
            var response = dispatcher.dispatch(
                    new IllegalStateException("password=hunter2 at db:27017"), new MockHttpServletRequest());

            assertThat(response.getStatusCode().value()).isEqualTo(500);
            assertThat(response.getBody().message()).isEqualTo("Internal Server Error");
        }

        @Test
        @DisplayName("dispatching the same error twice renders identical bodies")
        void idempotentBody() throws Exception {
            ApiError error = ApiError.conflict("A user with this email already exists");
            var mapper = new ObjectMapper();

            String first = mapper.writeValueAsString(dispatcher.dispatch(error, new MockHttpServletRequest()).getBody());
            String second = mapper.writeValueAsString(dispatcher.dispatch(error, new MockHttpServletRequest()).getBody());

            assertThat(first).isEqualTo(second).isEqualTo("{\"message\":\"A user with this email already exists\"}");
        }

        @Test
        @DisplayName("logs and counts a request once, however often it is dispatched")
        void recordsOncePerRequest() {
            var request = new MockHttpServletRequest("DELETE", "/items/abc");

            dispatcher.dispatch(ApiError.badRequest("Invalid id format for \"itemId\""), request);
            dispatcher.dispatch(ApiError.badRequest("Invalid id format for \"itemId\""), request);

            assertThat(appender.list).hasSize(1);
            assertThat(registry.find(ErrorDispatcher.FAILED_REQUESTS).tag("kind", "BAD_REQUEST").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("logs client errors at WARN and internal errors at ERROR")
        void logLevels() {
            dispatcher.dispatch(ApiError.forbidden(null), new MockHttpServletRequest());
            dispatcher.dispatch(new IllegalStateException("boom"), new MockHttpServletRequest());

            assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN, Level.ERROR);
            assertThat(appender.list.get(1).getThrowableProxy()).isNotNull();
        }

        @Test
        @DisplayName("redacts sensitive context values in the log record")
        void redactsContext() {
            dispatcher.dispatch(
                    ApiError.unauthorized(null).withContext("token", "eyJhbGciOiJIUzI1NiJ9.secret"),
                    new MockHttpServletRequest());

            assertThat(appender.list.get(0).getFormattedMessage())
                    .contains(SensitiveDataRedactor.REDACTED)
                    .doesNotContain("eyJhbGciOiJIUzI1NiJ9.secret");
        }
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("writes status and JSON body to the servlet response")
        void writesResponse() throws Exception {
            var response = new MockHttpServletResponse();

            dispatcher.write(ApiError.unauthorized("Authorization required"), new MockHttpServletRequest(), response);

            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentType()).startsWith("application/json");
            assertThat(response.getContentAsString()).isEqualTo("{\"message\":\"Authorization required\"}");
        }

        @Test
        @DisplayName("leaves a committed response untouched")
        void committedResponse() throws Exception {
            var response = new MockHttpServletResponse();
            response.setStatus(200);
            response.setCommitted(true);

            dispatcher.write(ApiError.unauthorized(null), new MockHttpServletRequest(), response);

            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getContentAsString()).isEmpty();
            assertThat(appender.list).noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.WARN));
        }
    }
}
