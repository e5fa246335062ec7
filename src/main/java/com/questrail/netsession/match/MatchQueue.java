package com.questrail.netsession.match;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

/**
 * MatchQueue
 * =============================================================================
 * Pairs an outstanding outbound request with a later, asynchronously delivered
 * inbound response.
 *
 * <h2>Outcomes of a pending request</h2>
 * <ul>
 *   <li><b>Matched</b>: the completion handle completes with the result passed to
 *       {@link #match}.</li>
 *   <li><b>Expired</b>: the handle completes exceptionally with a
 *       {@link MatchCancelledException} whose reason is
 *       {@link MatchCancelledException.Reason#EXPIRED}.</li>
 *   <li><b>Cleared</b>: likewise, with reason
 *       {@link MatchCancelledException.Reason#CLEARED}.</li>
 * </ul>
 * Each outcome happens at most once per request. A queue with no free slot
 * rejects {@link #add} with {@link MatchQueueFullException}; that is a terminal
 * failure for the call and is not retried here.
 *
 * @param <Q> request type
 * @param <R> result type delivered to the waiting caller
 */
public interface MatchQueue<Q, R>
{
    /**
     * Register a pending request.
     *
     * @param owner         identity the response must be matched against (compared by reference)
     * @param request       request descriptor handed to the match predicate
     * @param timeoutMillis time to live; values of 10 ms or less select the default
     * @param completion    handle resolved by match, expiry, or clear
     * @return {@code completion}
     * @throws MatchQueueFullException if every slot is occupied
     */
    default CompletableFuture<R> add(Object owner, Q request, int timeoutMillis, CompletableFuture<R> completion)
    {
        return add(owner, request, timeoutMillis, completion, null);
    }

    /**
     * As {@link #add(Object, Object, int, CompletableFuture)}, carrying an
     * optional trace tag that is reported with every transition of the slot.
     */
    CompletableFuture<R> add(Object owner, Q request, int timeoutMillis, CompletableFuture<R> completion, Object traceTag);

    /**
     * Resolve the first pending request of {@code owner} for which
     * {@code matcher.test(request, response)} holds.
     *
     * <p>The completion handle is resolved on a separate execution context, never
     * on the calling (receive) thread.</p>
     *
     * @return whether a pending request was matched
     */
    <S> boolean match(Object owner, S response, R result, BiPredicate<? super Q, ? super S> matcher);

    /**
     * Cancel every pending request.
     */
    void clear();

    /**
     * Number of occupied slots.
     */
    int pending();

    int capacity();
}
