package metering.java.grpc;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import metering.java.engine.EntitlementDecision;
import metering.java.engine.EntitlementRequest;
import metering.java.engine.FeatureUsage;
import metering.java.engine.MeteringEngine;
import metering.java.engine.SubscriptionRenewal;
import metering.java.engine.UsageEventRecorder;
import metering.proto.CheckEntitlementRequest;
import metering.proto.CheckEntitlementResponse;
import metering.proto.EntitlementServiceGrpc;
import metering.proto.FeatureUsageEntry;
import metering.proto.HealthCheckRequest;
import metering.proto.HealthCheckResponse;
import metering.proto.RecordUsageEventRequest;
import metering.proto.RecordUsageEventResponse;
import metering.proto.RenewSubscriptionRequest;
import metering.proto.RenewSubscriptionResponse;
import metering.proto.UsageSummaryRequest;
import metering.proto.UsageSummaryResponse;
import metering.proto.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * gRPC service implementation for the metering engine.
 *
 * <p>This is a thin wrapper over {@link MeteringEngine} with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Denials returned as regular responses carrying a machine-readable reason</li>
 *   <li>Error handling (INTERNAL for unexpected errors, without internal detail)</li>
 *   <li>Protobuf conversion</li>
 * </ul>
 *
 * <p>Thread-safety: the engine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class EntitlementServiceImpl extends EntitlementServiceGrpc.EntitlementServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(EntitlementServiceImpl.class);

    private final MeteringEngine engine;

    /**
     * @param engine metering engine (must be thread-safe)
     * @throws IllegalArgumentException if engine is null
     */
    public EntitlementServiceImpl(MeteringEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    @Override
    public void checkEntitlement(CheckEntitlementRequest request,
                                 StreamObserver<CheckEntitlementResponse> responseObserver) {
        respond(responseObserver, () -> {
            EntitlementDecision decision = engine.check(toRequest(
                request.getSubscriberId(), request.getFeatureCode(), request.getUnits()));
            return CheckEntitlementResponse.newBuilder()
                .setDecision(toVerdict(decision))
                .build();
        });
    }

    @Override
    public void recordUsageEvent(RecordUsageEventRequest request,
                                 StreamObserver<RecordUsageEventResponse> responseObserver) {
        respond(responseObserver, () -> {
            UsageEventRecorder.Result result = engine.recordEvent(
                toRequest(request.getSubscriberId(), request.getFeatureCode(), request.getUnits()),
                request.getEventId(),
                request.getMetadataMap());

            RecordUsageEventResponse.Builder response = RecordUsageEventResponse.newBuilder()
                .setStatus(RecordUsageEventResponse.Status.valueOf(result.status().name()))
                .setEventId(result.eventId());
            if (result.decision() != null) {
                response.setDecision(toVerdict(result.decision()));
            }
            return response.build();
        });
    }

    @Override
    public void getUsageSummary(UsageSummaryRequest request,
                                StreamObserver<UsageSummaryResponse> responseObserver) {
        respond(responseObserver, () -> {
            Optional<List<FeatureUsage>> summary = engine.summarize(requireSubscriber(request.getSubscriberId()));
            if (summary.isEmpty()) {
                throw Status.NOT_FOUND.withDescription("no active subscription").asRuntimeException();
            }
            UsageSummaryResponse.Builder response = UsageSummaryResponse.newBuilder();
            for (FeatureUsage usage : summary.get()) {
                response.addFeatures(FeatureUsageEntry.newBuilder()
                    .setFeatureCode(usage.featureCode())
                    .setLimit(usage.limit())
                    .setUsed(usage.used())
                    .setRemaining(usage.remainingLabel()));
            }
            return response.build();
        });
    }

    @Override
    public void renewSubscription(RenewSubscriptionRequest request,
                                  StreamObserver<RenewSubscriptionResponse> responseObserver) {
        respond(responseObserver, () -> {
            Optional<SubscriptionRenewal.Result> renewed = engine.renew(requireSubscriber(request.getSubscriberId()));
            if (renewed.isEmpty()) {
                throw Status.NOT_FOUND.withDescription("no active subscription to renew").asRuntimeException();
            }
            return RenewSubscriptionResponse.newBuilder()
                .setPlanId(renewed.get().planId())
                .setCountersReset(renewed.get().countersReset())
                .build();
        });
    }

    @Override
    public void healthCheck(HealthCheckRequest request,
                            StreamObserver<HealthCheckResponse> responseObserver) {
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(engine.storeHealthy()
                ? HealthCheckResponse.Status.SERVING
                : HealthCheckResponse.Status.NOT_SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (StatusRuntimeException e) {
            responseObserver.onError(e);
            return;
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .asRuntimeException()
            );
            return;
        } catch (Exception e) {
            // Store and I/O details stay in the log.
            log.error("Unexpected error serving metering RPC", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("internal error")
                    .asRuntimeException()
            );
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static EntitlementRequest toRequest(String subscriberId, String featureCode, long units) {
        // protobuf strings are never null, only empty
        if (subscriberId.isEmpty()) {
            throw new IllegalArgumentException("subscriber_id must not be empty");
        }
        if (featureCode.isEmpty()) {
            throw new IllegalArgumentException("feature_code must not be empty");
        }
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0, got: " + units);
        }
        return new EntitlementRequest(subscriberId, featureCode, units == 0 ? 1L : units);
    }

    private static String requireSubscriber(String subscriberId) {
        if (subscriberId.isEmpty()) {
            throw new IllegalArgumentException("subscriber_id must not be empty");
        }
        return subscriberId;
    }

    static Verdict toVerdict(EntitlementDecision decision) {
        return Verdict.newBuilder()
            .setAllowed(decision.allowed())
            .setReason(decision.reason().code())
            .setUsage(decision.usage())
            .setLimit(decision.limit())
            .setUnlimited(decision.unlimited())
            .setRemaining(decision.remaining())
            .setRemainingLabel(decision.remainingLabel())
            .setOverageUnits(decision.overageUnits())
            .setRetryAfterSeconds(decision.retryAfterSeconds())
            .build();
    }
}
