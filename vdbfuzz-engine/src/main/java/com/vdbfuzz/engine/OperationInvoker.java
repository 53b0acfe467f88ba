package com.vdbfuzz.engine;

import com.vdbfuzz.adapter.AdapterException;
import com.vdbfuzz.adapter.ServiceAdapter;
import com.vdbfuzz.model.BatchSearchData;
import com.vdbfuzz.model.DeleteData;
import com.vdbfuzz.model.DeleteParams;
import com.vdbfuzz.model.InsertData;
import com.vdbfuzz.model.InsertParams;
import com.vdbfuzz.model.MixedData;
import com.vdbfuzz.model.MixedParams;
import com.vdbfuzz.model.MixedStep;
import com.vdbfuzz.model.Operation;
import com.vdbfuzz.model.OperationParams;
import com.vdbfuzz.model.ResultData;
import com.vdbfuzz.model.SearchData;
import com.vdbfuzz.model.SearchHit;
import com.vdbfuzz.model.SearchParams;
import com.vdbfuzz.model.StepOutcome;
import com.vdbfuzz.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single responsibility: translate one {@link TestCase} into calls on one adapter and shape the
 * answer as {@link ResultData}. Inputs are passed through untouched.
 */
final class OperationInvoker {

    private static final Logger log = LoggerFactory.getLogger(OperationInvoker.class);

    private OperationInvoker() {
    }

    /**
     * Runs the test case against the adapter. A mixed sequence runs every step and records each
     * step's outcome, so only the non-mixed operations throw.
     */
    static ResultData invoke(ServiceAdapter adapter, TestCase testCase) throws AdapterException {
        String collection = testCase.collectionOr(adapter.defaultCollection());
        if (testCase.getOperation() == Operation.MIXED) {
            return invokeMixed(adapter, collection, testCase);
        }
        return invoke(adapter, collection, testCase.getOperation(), testCase.getParams());
    }

    /** Number of adapter calls the test case implies; used to size its deadline. */
    static int expectedCalls(TestCase testCase) {
        OperationParams params = testCase.getParams();
        return switch (testCase.getOperation()) {
            case MIXED -> Math.max(1, ((MixedParams) params).getSteps().size());
            case BATCH_SEARCH -> Math.max(1, ((SearchParams) params).getQueries().size());
            default -> 1;
        };
    }

    private static ResultData invoke(ServiceAdapter adapter, String collection, Operation operation,
                                     OperationParams params) throws AdapterException {
        switch (operation) {
            case INSERT:
            case BATCH_INSERT: {
                InsertParams p = (InsertParams) params;
                return new InsertData(adapter.insert(collection, p.getVectors(), p.getIds(), p.getMetadata()));
            }
            case SEARCH: {
                SearchParams p = (SearchParams) params;
                if (p.getQueries().isEmpty()) {
                    throw new IllegalArgumentException("search test case carries no query vector");
                }
                return new SearchData(adapter.search(collection, p.getQueries().get(0), p.getK(), p.getMetric()));
            }
            case BATCH_SEARCH: {
                SearchParams p = (SearchParams) params;
                List<List<SearchHit>> lists = adapter.batchSearch(collection, p.getQueries(), p.getK(), p.getMetric());
                List<SearchData> perQuery = new ArrayList<>(lists.size());
                for (List<SearchHit> hits : lists) {
                    perQuery.add(new SearchData(hits));
                }
                return new BatchSearchData(perQuery);
            }
            case DELETE: {
                DeleteParams p = (DeleteParams) params;
                return new DeleteData(adapter.delete(collection, p.getIds()));
            }
            default:
                throw new IllegalArgumentException("Operation not allowed here: " + operation);
        }
    }

    private static MixedData invokeMixed(ServiceAdapter adapter, String collection, TestCase testCase) {
        List<MixedStep> steps = ((MixedParams) testCase.getParams()).getSteps();
        List<StepOutcome> outcomes = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            // cancelled by the dispatcher deadline
            if (Thread.currentThread().isInterrupted()) break;
            MixedStep step = steps.get(i);
            try {
                outcomes.add(StepOutcome.success(i, step.getOperation(),
                        invoke(adapter, collection, step.getOperation(), step.getParams())));
            } catch (AdapterException e) {
                log.debug("Mixed step failed | service={} | testId={} | step={} | kind={} | error={}",
                        adapter.getServiceName(), testCase.getId(), i, e.getKind(), e.getMessage());
                outcomes.add(StepOutcome.failure(i, step.getOperation(), e.toResultError()));
            }
        }
        return new MixedData(outcomes);
    }
}
