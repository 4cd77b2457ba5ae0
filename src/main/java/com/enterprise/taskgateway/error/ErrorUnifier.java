package com.enterprise.taskgateway.error;

import com.enterprise.taskgateway.collaborator.AgentException;
import com.enterprise.taskgateway.collaborator.PublishException;
import com.enterprise.taskgateway.exception.DeadlineExceededException;
import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;
import com.enterprise.taskgateway.exception.ErrorKind;
import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.exception.InternalException;
import com.enterprise.taskgateway.exception.InvalidArgumentException;
import com.enterprise.taskgateway.exception.NotFoundException;
import com.enterprise.taskgateway.exception.UnavailableException;
import com.enterprise.taskgateway.router.DispatchPattern;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures from any dispatch pattern onto the gateway's single error
 * vocabulary. Failures that already are a {@link GatewayException} pass
 * through; everything unrecognized becomes INTERNAL.
 */
public class ErrorUnifier {

    private static final Logger logger = LoggerFactory.getLogger(ErrorUnifier.class);

    /**
     * Normalize a failure raised while serving a request with the given pattern
     */
    public GatewayException unify(Throwable failure, DispatchPattern pattern) {
        Throwable cause = unwrap(failure);

        if (cause instanceof GatewayException) {
            return (GatewayException) cause;
        }

        GatewayException unified;
        if (cause instanceof TimeoutException) {
            unified = new DeadlineExceededException(describe(pattern) + " did not finish before its deadline", cause);
        } else if (cause instanceof StatusRuntimeException || cause instanceof StatusException) {
            unified = fromStatus(Status.fromThrowable(cause), cause);
        } else if (cause instanceof SQLException) {
            unified = fromDatastore((SQLException) cause);
        } else if (cause instanceof PublishException) {
            unified = fromQueue((PublishException) cause);
        } else if (cause instanceof AgentException) {
            unified = fromAgent((AgentException) cause);
        } else if (pattern == DispatchPattern.QUEUE_PUBLISH && cause instanceof JsonProcessingException) {
            unified = new EncodingException("Job could not be serialized: " + cause.getMessage(), cause);
        } else if (pattern == DispatchPattern.AGENT_INVOKE) {
            unified = fromAgentTransport(cause);
        } else {
            unified = new InternalException(describe(pattern) + " failed: " + cause, cause);
        }

        unified.withContext("pattern", pattern != null ? pattern.name() : null)
            .withContext("cause", cause.getClass().getName());
        if (unified.getKind() == ErrorKind.INTERNAL) {
            logger.error("Unclassified failure from {}", describe(pattern), cause);
        } else {
            logger.debug("Unified {} from {} as {}", cause.getClass().getSimpleName(), describe(pattern),
                        unified.getKind());
        }
        return unified;
    }

    public GatewayError toError(Throwable failure, DispatchPattern pattern) {
        return GatewayError.of(unify(failure, pattern));
    }

    private GatewayException fromDatastore(SQLException e) {
        String sqlState = e.getSQLState() != null ? e.getSQLState() : "";
        GatewayException unified;
        if (e instanceof SQLTimeoutException) {
            unified = new DeadlineExceededException("Datastore query timed out", e);
        } else if (e instanceof SQLIntegrityConstraintViolationException
                   || sqlState.startsWith("22") || sqlState.startsWith("23")) {
            unified = new InvalidArgumentException("Datastore rejected the data: " + e.getMessage(), e);
        } else if (e instanceof SQLTransientConnectionException
                   || e instanceof SQLNonTransientConnectionException
                   || sqlState.startsWith("08")) {
            unified = new UnavailableException("Datastore unreachable: " + e.getMessage(), e);
        } else {
            unified = new InternalException("Datastore failure: " + e.getMessage(), e);
        }
        return unified.withContext("sql.state", e.getSQLState());
    }

    private GatewayException fromQueue(PublishException e) {
        String prefix = e.isRejected() ? "Broker rejected message: " : "Publish failed: ";
        return new UnavailableException(prefix + e.getMessage(), e)
            .withContext("queue.subject", e.getSubject())
            .withContext("queue.rejected", String.valueOf(e.isRejected()));
    }

    private GatewayException fromAgent(AgentException e) {
        int code = e.getStatusCode();
        GatewayException unified;
        if (code == 404) {
            unified = new NotFoundException("agent", e.getMessage(), e);
        } else if (code == 408 || code == 504) {
            unified = new DeadlineExceededException(e.getMessage(), e);
        } else if (code >= 400 && code < 500) {
            unified = new InvalidArgumentException(e.getMessage(), e);
        } else if (code >= 500) {
            unified = new UnavailableException(e.getMessage(), e);
        } else {
            unified = new InternalException(e.getMessage(), e);
        }
        return unified.withContext("http.status", String.valueOf(code));
    }

    private GatewayException fromAgentTransport(Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new DeadlineExceededException("Agent did not answer in time", cause);
        }
        if (cause instanceof JsonProcessingException) {
            return new DecodingException("Malformed agent response: " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException) {
            return new UnavailableException("Agent unreachable: " + cause.getMessage(), cause);
        }
        return new InternalException("Agent invocation failed: " + cause, cause);
    }

    private GatewayException fromStatus(Status status, Throwable cause) {
        String description = status.getDescription() != null ? status.getDescription() : status.getCode().name();
        GatewayException unified;
        switch (status.getCode()) {
            case NOT_FOUND:
                unified = new NotFoundException("unknown", description, cause);
                break;
            case INVALID_ARGUMENT:
            case OUT_OF_RANGE:
            case FAILED_PRECONDITION:
                unified = new InvalidArgumentException(description, cause);
                break;
            case UNAVAILABLE:
            case RESOURCE_EXHAUSTED:
                unified = new UnavailableException(description, cause);
                break;
            case DEADLINE_EXCEEDED:
                unified = new DeadlineExceededException(description, cause);
                break;
            default:
                unified = new InternalException(description, cause);
                break;
        }
        return unified.withContext("grpc.status", status.getCode().name());
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause.getCause() != null
               && (cause instanceof CompletionException
                   || cause instanceof ExecutionException
                   || cause instanceof UncheckedIOException)) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(DispatchPattern pattern) {
        return pattern != null ? pattern.name() : "request";
    }
}
