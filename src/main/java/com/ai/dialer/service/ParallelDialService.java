package com.ai.dialer.service;

import com.ai.dialer.component.ConferenceTwimlBuilder;
import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.dto.ParallelDialRequest;
import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.exception.DialerException;
import com.ai.dialer.exception.GroupNotFoundException;
import com.ai.dialer.exception.InvalidDialRequestException;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.AnsweredBy;
import com.ai.dialer.model.AttemptStatus;
import com.ai.dialer.model.ConferenceOptions;
import com.ai.dialer.model.EarlyCallback;
import com.ai.dialer.model.NumberPool;
import com.ai.dialer.model.NumberSelection;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.ParallelCallAttempt;
import com.ai.dialer.model.ParallelDialGroup;
import com.ai.dialer.model.ParallelDialRequirements;
import com.ai.dialer.model.ParallelGroupStatus;
import com.ai.dialer.model.PhoneNumberCandidate;
import com.ai.dialer.model.ProviderCallStatus;
import com.ai.dialer.store.ParallelGroupStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Parallel dialer: several simultaneous calls to one contact, each from its own locked caller ID.
 * The first human answer wins, every other leg is hung up.
 *
 * <p>All group mutations go through {@link ParallelGroupStore#update}, so callbacks for one group
 * are applied one at a time and the winner is committed through the store's compare-and-set.
 * Provider side effects (hangups, lock releases) run after the update, and only for transitions
 * the update actually made, which keeps redelivered callbacks free of side effects.
 */
@Service
public class ParallelDialService {

    private static final Logger log = LoggerFactory.getLogger(ParallelDialService.class);

    public static final String STATUS_CALLBACK_PATH = "/v1/calls/parallel/status-callback";
    public static final String CUSTOMER_TWIML_PATH = "/v1/calls/parallel/customer-twiml";

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
    private static final int GROUP_ID_ATTEMPTS = 3;

    /** Query parameter added to status callback URLs so a callback can be routed before its call is mapped. */
    public static final String GROUP_ID_PARAM = "groupId";

    private final ParallelGroupStore store;
    private final TelephonyGateway telephony;
    private final CallerIdLockService lockService;
    private final LocalPresenceService localPresence;
    private final ConferenceTwimlBuilder twimlBuilder;
    private final DialerProperties properties;
    private final Clock clock;

    public ParallelDialService(ParallelGroupStore store,
                               TelephonyGateway telephony,
                               CallerIdLockService lockService,
                               LocalPresenceService localPresence,
                               ConferenceTwimlBuilder twimlBuilder,
                               DialerProperties properties,
                               Clock clock) {
        this.store = store;
        this.telephony = telephony;
        this.lockService = lockService;
        this.localPresence = localPresence;
        this.twimlBuilder = twimlBuilder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Locks one caller ID per customer number and places the calls.
     *
     * @throws CallerIdLockedException when a caller ID is busy; nothing is dialed
     * @throws TelephonyException when the provider rejects a dial; placed legs are hung up and
     *                            every lock is released
     */
    public ParallelDialGroup initiateGroup(ParallelDialRequest request) {
        validate(request);
        String groupId = generateGroupId();
        List<String> fromNumbers = resolveFromNumbers(request);
        List<String> provisional = acquireLocks(groupId, request.holderId(), fromNumbers);

        ParallelDialGroup group = ParallelDialGroup.builder()
                .groupId(groupId)
                .queueId(request.queueId())
                .holderId(request.holderId())
                .conferenceName(groupId + "_" + request.queueId())
                .status(ParallelGroupStatus.PENDING)
                .expectedCalls(fromNumbers.size())
                .createdAt(clock.instant())
                .build();
        store.save(group);
        log.info("Parallel group {} created for queue {} with {} calls", groupId, request.queueId(), fromNumbers.size());

        String baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(properties.getBaseUrl()), "/");
        String statusCallbackUrl = UriComponentsBuilder
                .fromUriString(StringUtils.defaultIfBlank(request.statusCallbackUrl(), baseUrl + STATUS_CALLBACK_PATH))
                .queryParam(GROUP_ID_PARAM, groupId)
                .toUriString();
        String customerTwimlUrl = StringUtils.defaultIfBlank(request.customerTwimlUrl(), baseUrl + CUSTOMER_TWIML_PATH);

        List<String> customerNumbers = request.customerNumbers();
        for (int i = 0; i < customerNumbers.size(); i++) {
            if (i > 0) {
                stagger();
            }
            String callReference;
            try {
                callReference = telephony.dial(new OutboundCall(customerNumbers.get(i), fromNumbers.get(i),
                        customerTwimlUrl, statusCallbackUrl, true));
            } catch (TelephonyException e) {
                abortInitiation(groupId, provisional);
                throw e;
            }
            lockService.rebind(fromNumbers.get(i), provisional.get(i), callReference);

            ParallelCallAttempt attempt = ParallelCallAttempt.builder()
                    .callReference(callReference)
                    .customerNumber(customerNumbers.get(i))
                    .fromNumber(fromNumbers.get(i))
                    .position(i + 1)
                    .status(AttemptStatus.INITIATED)
                    .contactId(contactIdAt(request.contactIds(), i))
                    .build();
            List<CallbackOutcome> replayed = new ArrayList<>();
            boolean accepted = store.update(groupId, g -> {
                // mapped while the group is held, so a concurrent callback for this leg waits for the attempt
                store.mapCall(callReference, groupId);
                g.getCalls().add(attempt);
                List<EarlyCallback> early = g.takeEarlyCallbacks(callReference);
                if (g.getStatus().isTerminal() || g.hasWinner()) {
                    attempt.setStatus(AttemptStatus.TERMINATED);
                    return false;
                }
                if (g.getStatus() == ParallelGroupStatus.PENDING) {
                    g.setStatus(ParallelGroupStatus.DIALING);
                }
                for (EarlyCallback callback : early) {
                    replayed.add(applyCallback(g, callReference, callback.status(), callback.answeredBy()));
                }
                return true;
            }).orElse(false);
            if (!accepted) {
                log.info("Group {} resolved during dialing; dropping call {}", groupId, callReference);
                hangUpQuietly(callReference);
                lockService.release(callReference);
            }
            replayed.forEach(outcome -> applyOutcome(groupId, callReference, outcome));
        }
        return store.find(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    /**
     * Applies one provider status notification. Unknown calls, unknown statuses, duplicates and
     * stale progress updates are ignored. A callback that names a group still being dialed but
     * whose leg is not recorded yet is held and applied when the leg is added.
     *
     * @param groupIdHint group taken from the callback URL; used only when the call is not mapped yet
     */
    public void handleStatusCallback(String callReference, String providerStatus, String answeredBy, String groupIdHint) {
        Optional<ProviderCallStatus> status = ProviderCallStatus.fromProvider(providerStatus);
        if (status.isEmpty()) {
            log.warn("Ignoring callback for {} with unknown status '{}'", callReference, providerStatus);
            return;
        }
        Optional<String> groupId = store.findGroupIdForCall(callReference)
                .or(() -> Optional.ofNullable(StringUtils.trimToNull(groupIdHint)));
        if (groupId.isEmpty()) {
            log.debug("No parallel group for call {}; ignoring {}", callReference, providerStatus);
            return;
        }
        AnsweredBy classification = AnsweredBy.fromProvider(answeredBy).orElse(null);
        CallbackOutcome outcome = store.update(groupId.get(), group -> {
                    if (group.findAttempt(callReference).isEmpty() && group.isStillDialing()) {
                        group.getEarlyCallbacks().add(new EarlyCallback(callReference, status.get(), classification));
                        log.debug("Holding {} for {} until the leg is recorded", providerStatus, callReference);
                        return CallbackOutcome.NONE;
                    }
                    return applyCallback(group, callReference, status.get(), classification);
                })
                .orElse(CallbackOutcome.NONE);

        if (!outcome.changed()) {
            log.debug("Callback {} for {} caused no change", providerStatus, callReference);
            return;
        }
        applyOutcome(groupId.get(), callReference, outcome);
    }

    public Optional<String> getGroupIdForCall(String callReference) {
        return store.findGroupIdForCall(callReference);
    }

    public Optional<ParallelDialGroup> getGroup(String groupId) {
        return store.find(groupId);
    }


    /**
     * Caller IDs of all non-winning legs, available once the group has a winner. The winner's
     * own caller ID stays locked until its call ends.
     */
    public List<String> getReleasableNumbers(ParallelDialGroup group) {
        if (!group.getStatus().hasReleasableNumbers()) {
            return List.of();
        }
        return group.getCalls().stream()
                .filter(c -> !group.isWinner(c))
                .map(ParallelCallAttempt::getFromNumber)
                .toList();
    }

    /**
     * Operator abort: hangs up every live leg and releases every lock of the group.
     */
    public ParallelDialGroup terminateGroup(String groupId) {
        List<String> hangups = new ArrayList<>();
        List<String> releases = new ArrayList<>();
        ParallelGroupStatus previous = store.update(groupId, group -> {
            ParallelGroupStatus before = group.getStatus();
            if (!before.isTerminal()) {
                for (ParallelCallAttempt call : group.getCalls()) {
                    if (!call.isTerminal() || isLiveMachineLeg(call)) {
                        hangups.add(call.getCallReference());
                    }
                    if (!call.isTerminal()) {
                        call.setStatus(AttemptStatus.TERMINATED);
                    }
                }
                group.setStatus(ParallelGroupStatus.TERMINATED);
            }
            group.getCalls().forEach(c -> releases.add(c.getCallReference()));
            return before;
        }).orElseThrow(() -> new GroupNotFoundException(groupId));

        hangups.forEach(this::hangUpQuietly);
        releases.forEach(lockService::release);
        for (int position = 1; position <= properties.getParallel().getBatchSize(); position++) {
            lockService.release(provisionalReference(groupId, position));
        }
        if (previous.isTerminal()) {
            log.info("Parallel group {} already {}; released leftover locks", groupId, previous);
        } else {
            log.info("Parallel group {} terminated by operator, hung up {} calls", groupId, hangups.size());
        }
        return store.find(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    /**
     * Markup served when a customer leg answers: the leg joins the group's conference, or is
     * hung up if it already lost.
     */
    public Optional<String> generateCustomerTwiml(String callReference) {
        return store.findGroupIdForCall(callReference)
                .flatMap(store::find)
                .map(group -> {
                    boolean lost = group.findAttempt(callReference)
                            .map(a -> a.isTerminal() && !group.isWinner(a))
                            .orElse(true);
                    if (lost) {
                        return twimlBuilder.hangup();
                    }
                    return twimlBuilder.joinConference(group.getConferenceName(), ConferenceOptions.customer());
                });
    }

    public ParallelDialRequirements validateRequirements(int numberCount) {
        int required = properties.getParallel().getBatchSize();
        if (numberCount >= required) {
            return new ParallelDialRequirements(true, required, numberCount, null);
        }
        return new ParallelDialRequirements(false, required, numberCount,
                "Need at least " + required + " phone numbers");
    }

    private CallbackOutcome applyCallback(ParallelDialGroup group, String callReference,
                                          ProviderCallStatus status, AnsweredBy answeredBy) {
        ParallelCallAttempt attempt = group.findAttempt(callReference).orElse(null);
        if (attempt == null) {
            return CallbackOutcome.NONE;
        }
        ParallelGroupStatus groupBefore = group.getStatus();

        if (group.isWinner(attempt)) {
            if (status.isEnded() && groupBefore == ParallelGroupStatus.CONNECTED) {
                attempt.setStatus(AttemptStatus.TERMINATED);
                group.setStatus(ParallelGroupStatus.COMPLETED);
                return new CallbackOutcome(true, false, List.of(), List.of(callReference), ParallelGroupStatus.COMPLETED);
            }
            return CallbackOutcome.NONE;
        }
        if (attempt.isTerminal()) {
            return CallbackOutcome.NONE;
        }

        AttemptStatus attemptBefore = attempt.getStatus();
        AnsweredBy classificationBefore = attempt.getAnsweredBy();
        if (answeredBy != null && attempt.getAnsweredBy() != AnsweredBy.MACHINE) {
            attempt.setAnsweredBy(answeredBy);
        }
        advance(attempt, status);

        List<String> hangups = new ArrayList<>();
        boolean won = false;
        if (attempt.getAnsweredBy() != null && !attempt.getAnsweredBy().canWin() && !attempt.isTerminal()) {
            // voicemail can never win; the leg stays up until the group resolves
            attempt.setStatus(AttemptStatus.NO_ANSWER);
        } else if (attempt.getStatus() == AttemptStatus.ANSWERED && attempt.getAnsweredBy() != null) {
            if (!group.hasWinner() && !groupBefore.isTerminal()
                    && store.setWinnerIfAbsent(group.getGroupId(), callReference)) {
                group.setWinnerCallReference(callReference);
                group.setStatus(ParallelGroupStatus.CONNECTED);
                won = true;
                for (ParallelCallAttempt other : group.getCalls()) {
                    if (other == attempt) {
                        continue;
                    }
                    if (!other.isTerminal()) {
                        other.setStatus(AttemptStatus.TERMINATED);
                        hangups.add(other.getCallReference());
                    } else if (isLiveMachineLeg(other)) {
                        hangups.add(other.getCallReference());
                    }
                }
            } else {
                attempt.setStatus(AttemptStatus.TERMINATED);
                hangups.add(callReference);
            }
        }

        if (!group.hasWinner() && !group.getStatus().isTerminal() && group.allAttemptsTerminal()) {
            group.setStatus(ParallelGroupStatus.FAILED);
            group.getCalls().stream()
                    .filter(ParallelDialService::isLiveMachineLeg)
                    .forEach(c -> hangups.add(c.getCallReference()));
        }

        boolean changed = attempt.getStatus() != attemptBefore
                || attempt.getAnsweredBy() != classificationBefore
                || group.getStatus() != groupBefore;
        List<String> releases = new ArrayList<>();
        if (group.getStatus() != groupBefore
                && (group.getStatus() == ParallelGroupStatus.CONNECTED || group.getStatus() == ParallelGroupStatus.FAILED)) {
            group.getCalls().stream()
                    .filter(c -> !group.isWinner(c))
                    .forEach(c -> releases.add(c.getCallReference()));
        }
        return new CallbackOutcome(changed, won, hangups, releases, group.getStatus());
    }

    private void applyOutcome(String groupId, String callReference, CallbackOutcome outcome) {
        if (outcome.won()) {
            log.info("Call {} won parallel group {}", callReference, groupId);
        }
        if (outcome.groupStatus() == ParallelGroupStatus.FAILED) {
            log.info("Parallel group {} failed: no human answered", groupId);
        }
        outcome.hangups().forEach(this::hangUpQuietly);
        outcome.releases().forEach(lockService::release);
    }

    private static void advance(ParallelCallAttempt attempt, ProviderCallStatus status) {
        switch (status) {
            case QUEUED, INITIATED -> moveForward(attempt, AttemptStatus.INITIATED);
            case RINGING -> moveForward(attempt, AttemptStatus.RINGING);
            case IN_PROGRESS, ANSWERED -> moveForward(attempt, AttemptStatus.ANSWERED);
            case BUSY -> attempt.setStatus(AttemptStatus.BUSY);
            case FAILED -> attempt.setStatus(AttemptStatus.FAILED);
            case NO_ANSWER, CANCELED -> attempt.setStatus(AttemptStatus.NO_ANSWER);
            case COMPLETED -> attempt.setStatus(attempt.getStatus() == AttemptStatus.ANSWERED
                    ? AttemptStatus.TERMINATED
                    : AttemptStatus.NO_ANSWER);
        }
    }

    /** Progress statuses arriving late never move an attempt backwards. */
    private static void moveForward(ParallelCallAttempt attempt, AttemptStatus next) {
        if (attempt.getStatus().isBefore(next)) {
            attempt.setStatus(next);
        }
    }

    /** A leg classified as voicemail is parked as NO_ANSWER but still connected. */
    private static boolean isLiveMachineLeg(ParallelCallAttempt call) {
        return call.getAnsweredBy() == AnsweredBy.MACHINE && call.getStatus() == AttemptStatus.NO_ANSWER;
    }

    private void validate(ParallelDialRequest request) {
        int batchSize = properties.getParallel().getBatchSize();
        List<String> customerNumbers = request.customerNumbers();
        if (customerNumbers == null || customerNumbers.size() != batchSize) {
            throw new InvalidDialRequestException("Requires exactly " + batchSize + " customer numbers");
        }
        if (StringUtils.isBlank(request.queueId())) {
            throw new InvalidDialRequestException("queueId is required");
        }
        List<String> invalid = customerNumbers.stream()
                .filter(n -> n == null || !E164.matcher(n).matches())
                .toList();
        if (!invalid.isEmpty()) {
            throw new InvalidDialRequestException("Invalid E.164 numbers: " + String.join(", ", invalid));
        }
        if (request.fromNumbers() != null && !request.fromNumbers().isEmpty()
                && request.fromNumbers().size() != batchSize) {
            throw new InvalidDialRequestException("fromNumbers must match customerNumbers");
        }
    }

    /**
     * Explicit caller IDs first, then local presence over the pool numbers not yet taken and
     * not locked by another call, then the default number. Each caller ID is used once.
     */
    private List<String> resolveFromNumbers(ParallelDialRequest request) {
        NumberPool pool = request.numberPool() == null ? NumberPool.empty() : request.numberPool();
        List<String> customerNumbers = request.customerNumbers();
        List<String> resolved = new ArrayList<>(customerNumbers.size());
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < customerNumbers.size(); i++) {
            String explicit = request.fromNumbers() == null || request.fromNumbers().isEmpty()
                    ? null
                    : StringUtils.trimToNull(request.fromNumbers().get(i));
            if (explicit != null && !taken.add(explicit)) {
                throw new InvalidDialRequestException("Caller ID " + explicit + " given for more than one call");
            }
            resolved.add(explicit);
        }
        for (int i = 0; i < customerNumbers.size(); i++) {
            if (resolved.get(i) != null) {
                continue;
            }
            String customerNumber = customerNumbers.get(i);
            String from = localPresence.selectNumber(remaining(pool, taken), customerNumber)
                    .map(NumberSelection::phoneNumber)
                    .orElse(StringUtils.trimToNull(properties.getDefaultNumber()));
            if (from == null || !taken.add(from)) {
                throw new InvalidDialRequestException("No free caller ID for " + customerNumber);
            }
            resolved.set(i, from);
        }
        return resolved;
    }

    private NumberPool remaining(NumberPool pool, Set<String> taken) {
        List<PhoneNumberCandidate> free = pool.numbers().stream()
                .filter(n -> !taken.contains(n.phoneNumber()) && lockService.isAvailable(n.phoneNumber()))
                .toList();
        PhoneNumberCandidate primary = pool.primaryNumber();
        if (primary != null && (taken.contains(primary.phoneNumber()) || !lockService.isAvailable(primary.phoneNumber()))) {
            primary = null;
        }
        return new NumberPool(free, primary);
    }

    private List<String> acquireLocks(String groupId, String holderId, List<String> fromNumbers) {
        List<String> provisional = new ArrayList<>();
        for (int i = 0; i < fromNumbers.size(); i++) {
            String reference = provisionalReference(groupId, i + 1);
            if (!lockService.acquire(fromNumbers.get(i), holderId, reference)) {
                provisional.forEach(lockService::release);
                throw new CallerIdLockedException(fromNumbers.get(i));
            }
            provisional.add(reference);
        }
        return provisional;
    }

    private void abortInitiation(String groupId, List<String> provisional) {
        List<String> placed = new ArrayList<>();
        store.update(groupId, group -> {
            for (ParallelCallAttempt call : group.getCalls()) {
                if (!call.isTerminal()) {
                    call.setStatus(AttemptStatus.TERMINATED);
                    placed.add(call.getCallReference());
                }
            }
            group.setStatus(ParallelGroupStatus.FAILED);
            return null;
        });
        placed.forEach(this::hangUpQuietly);
        placed.forEach(lockService::release);
        provisional.forEach(lockService::release);
        log.error("Parallel group {} aborted after provider rejected a dial; hung up {} calls", groupId, placed.size());
    }

    private void hangUpQuietly(String callReference) {
        try {
            telephony.hangup(callReference);
        } catch (TelephonyException e) {
            // the leg may already have ended on the provider side
            log.warn("Hangup of {} failed: {}", callReference, e.getMessage());
        }
    }

    private void stagger() {
        Duration delay = properties.getParallel().getStagger();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String generateGroupId() {
        for (int i = 0; i < GROUP_ID_ATTEMPTS; i++) {
            String id = "pg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            if (!store.exists(id)) {
                return id;
            }
        }
        throw new DialerException("Failed to generate unique group ID after " + GROUP_ID_ATTEMPTS + " attempts");
    }

    static String provisionalReference(String groupId, int position) {
        return groupId + ":" + position;
    }

    private static String contactIdAt(List<String> contactIds, int index) {
        return contactIds != null && index < contactIds.size() ? contactIds.get(index) : null;
    }

    private record CallbackOutcome(boolean changed,
                                   boolean won,
                                   List<String> hangups,
                                   List<String> releases,
                                   ParallelGroupStatus groupStatus) {

        static final CallbackOutcome NONE = new CallbackOutcome(false, false, List.of(), List.of(), null);
    }
}
