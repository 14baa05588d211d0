package com.seveninterprise.healthalert.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Resultado item a item de uma criação em lote
 */
public class BulkAlertResponse {

    private final List<ItemResult> results = new ArrayList<>();

    public static class ItemResult {
        private final int index;
        private final boolean success;
        private final String alertId;
        private final String error;

        public ItemResult(int index, boolean success, String alertId, String error) {
            this.index = index;
            this.success = success;
            this.alertId = alertId;
            this.error = error;
        }

        public int getIndex() {
            return index;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getAlertId() {
            return alertId;
        }

        public String getError() {
            return error;
        }
    }

    public void addSuccess(int index, String alertId) {
        results.add(new ItemResult(index, true, alertId, null));
    }

    public void addFailure(int index, String error) {
        results.add(new ItemResult(index, false, null, error));
    }

    public List<ItemResult> getResults() {
        return results;
    }

    public long getSuccessCount() {
        return results.stream().filter(ItemResult::isSuccess).count();
    }

    public long getFailureCount() {
        return results.size() - getSuccessCount();
    }
}
