package com.example.tripstate.feasibility;

/**
 * @param verdict overall verdict, one of "yes", "maybe", "no"
 * @param score   confidence 0-100
 */
public record FeasibilityReport(String verdict, int score) {}
