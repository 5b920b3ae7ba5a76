package com.phonepe.contextspace.core.identity;

public record WeightedSignal(MatchSignal signal, double weight) {
}
