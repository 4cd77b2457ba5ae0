package com.enterprise.taskgateway.error;

import com.enterprise.taskgateway.collaborator.AgentException;
import com.enterprise.taskgateway.collaborator.PublishException;
import com.enterprise.taskgateway.exception.ErrorKind;
import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.exception.NotFoundException;
import com.enterprise.taskgateway.router.DispatchPattern;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUnifierTest {

    private ErrorUnifier unifier;

    @BeforeEach
    void setUp() {
        unifier = new ErrorUnifier();
    }

    @Test
    void testGatewayExceptionPassesThrough() {
        NotFoundException original = new NotFoundException("task-1");

        GatewayException unified = unifier.unify(new CompletionException(original), DispatchPattern.RPC);

        assertSame(original, unified);
    }

    @Test
    void testNestedWrappersAreUnwrapped() {
        NotFoundException original = new NotFoundException("task-1");

        GatewayException unified = unifier.unify(
            new CompletionException(new ExecutionException(original)), DispatchPattern.RPC);

        assertSame(original, unified);
    }

    @Test
    void testTimeoutIsDeadlineExceeded() {
        GatewayException unified = unifier.unify(new TimeoutException(), DispatchPattern.AGENT_INVOKE);

        assertEquals(ErrorKind.DEADLINE_EXCEEDED, unified.getKind());
        assertEquals("AGENT_INVOKE", unified.getContext().get("pattern"));
    }

    @Test
    void testStatusCodesMapToKinds() {
        assertEquals(ErrorKind.NOT_FOUND,
            unifier.unify(Status.NOT_FOUND.asRuntimeException(), DispatchPattern.RPC).getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
            unifier.unify(Status.FAILED_PRECONDITION.asRuntimeException(), DispatchPattern.RPC).getKind());
        assertEquals(ErrorKind.UNAVAILABLE,
            unifier.unify(Status.RESOURCE_EXHAUSTED.asException(), DispatchPattern.RPC).getKind());
        assertEquals(ErrorKind.DEADLINE_EXCEEDED,
            unifier.unify(Status.DEADLINE_EXCEEDED.asRuntimeException(), DispatchPattern.RPC).getKind());

        GatewayException internal = unifier.unify(Status.DATA_LOSS.asRuntimeException(), DispatchPattern.RPC);
        assertEquals(ErrorKind.INTERNAL, internal.getKind());
        assertEquals("DATA_LOSS", internal.getContext().get("grpc.status"));
    }

    @Test
    void testSqlFailuresMapByClassAndState() {
        assertEquals(ErrorKind.DEADLINE_EXCEEDED,
            unifier.unify(new SQLTimeoutException("slow"), DispatchPattern.DIRECT_DATASTORE).getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
            unifier.unify(new SQLIntegrityConstraintViolationException("dup"), DispatchPattern.DIRECT_DATASTORE)
                .getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
            unifier.unify(new SQLException("bad value", "22001"), DispatchPattern.DIRECT_DATASTORE).getKind());
        assertEquals(ErrorKind.UNAVAILABLE,
            unifier.unify(new SQLTransientConnectionException("pool"), DispatchPattern.DIRECT_DATASTORE)
                .getKind());
        assertEquals(ErrorKind.UNAVAILABLE,
            unifier.unify(new SQLException("refused", "08001"), DispatchPattern.DIRECT_DATASTORE).getKind());

        GatewayException other = unifier.unify(new SQLException("syntax", "42601"), DispatchPattern.DIRECT_DATASTORE);
        assertEquals(ErrorKind.INTERNAL, other.getKind());
        assertEquals("42601", other.getContext().get("sql.state"));
    }

    @Test
    void testPublishFailureIsUnavailable() {
        GatewayException unified = unifier.unify(
            new PublishException("emails", "stream full", true), DispatchPattern.QUEUE_PUBLISH);

        assertEquals(ErrorKind.UNAVAILABLE, unified.getKind());
        assertTrue(unified.isRetryable());
        assertEquals("emails", unified.getContext().get("queue.subject"));
        assertEquals("true", unified.getContext().get("queue.rejected"));
    }

    @Test
    void testQueueSerializationFailureIsEncodingError() {
        GatewayException unified = unifier.unify(
            new JsonParseException(null, "bad job"), DispatchPattern.QUEUE_PUBLISH);

        assertEquals(ErrorKind.ENCODING_ERROR, unified.getKind());
    }

    @Test
    void testAgentHttpStatusesMapToKinds() {
        assertEquals(ErrorKind.NOT_FOUND,
            unifier.unify(new AgentException(404, "no agent"), DispatchPattern.AGENT_INVOKE).getKind());
        assertEquals(ErrorKind.DEADLINE_EXCEEDED,
            unifier.unify(new AgentException(504, "gateway timeout"), DispatchPattern.AGENT_INVOKE).getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
            unifier.unify(new AgentException(422, "bad prompt"), DispatchPattern.AGENT_INVOKE).getKind());

        GatewayException unavailable = unifier.unify(new AgentException(503, "busy"), DispatchPattern.AGENT_INVOKE);
        assertEquals(ErrorKind.UNAVAILABLE, unavailable.getKind());
        assertEquals("503", unavailable.getContext().get("http.status"));
    }

    @Test
    void testAgentTransportFailures() {
        assertEquals(ErrorKind.DEADLINE_EXCEEDED,
            unifier.unify(new HttpTimeoutException("timed out"), DispatchPattern.AGENT_INVOKE).getKind());
        assertEquals(ErrorKind.UNAVAILABLE,
            unifier.unify(new CompletionException(new ConnectException("refused")), DispatchPattern.AGENT_INVOKE)
                .getKind());
        assertEquals(ErrorKind.DECODING_ERROR,
            unifier.unify(new UncheckedIOException(new JsonParseException(null, "not json")),
                DispatchPattern.AGENT_INVOKE).getKind());
    }

    @Test
    void testUnknownFailureIsInternal() {
        GatewayException unified = unifier.unify(new IllegalStateException("boom"), DispatchPattern.RPC);

        assertEquals(ErrorKind.INTERNAL, unified.getKind());
        assertFalse(unified.isRetryable());
        assertEquals(IllegalStateException.class.getName(), unified.getContext().get("cause"));
    }

    @Test
    void testIoFailureOutsideAgentIsInternal() {
        GatewayException unified = unifier.unify(new IOException("disk"), DispatchPattern.DIRECT_DATASTORE);

        assertEquals(ErrorKind.INTERNAL, unified.getKind());
    }

    @Test
    void testErrorSerializesWithStableFields() throws Exception {
        GatewayError error = unifier.toError(new AgentException(503, "busy"), DispatchPattern.AGENT_INVOKE);

        JsonNode json = new ObjectMapper().valueToTree(error);

        assertEquals("UNAVAILABLE", json.path("kind").asText());
        assertEquals("busy", json.path("message").asText());
        assertTrue(json.path("retryable").asBoolean());
        assertEquals("503", json.path("context").path("http.status").asText());
    }
}
