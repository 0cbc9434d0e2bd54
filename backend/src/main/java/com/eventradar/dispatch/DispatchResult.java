package com.eventradar.dispatch;

public record DispatchResult(boolean success, String error) {

    public static DispatchResult ok() {
        return new DispatchResult(true, null);
    }

    public static DispatchResult failed(String error) {
        return new DispatchResult(false, error);
    }
}
