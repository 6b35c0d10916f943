package com.franchiseplatform.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.franchiseplatform.common.exception.InvalidOfferException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable salary proposal exchanged between the user's team and a player's agent.
 *
 * <p>All amounts are whole dollars. The compact constructor enforces the structural
 * rules, so every instance in circulation is valid:
 * <ul>
 *   <li>{@code years > 0} and {@code baseSalaryPerYear.size() == years}</li>
 *   <li>no negative salary, bonus, guarantee or incentive amounts</li>
 *   <li>{@code voidYears >= 0}</li>
 *   <li>{@code guaranteedMoney <= sum(baseSalaryPerYear) + signingBonus}</li>
 * </ul>
 */
public record ContractOffer(
    @JsonProperty("id")                String     id,
    @JsonProperty("years")             int        years,
    @JsonProperty("baseSalaryPerYear") List<Long> baseSalaryPerYear,
    @JsonProperty("signingBonus")      long       signingBonus,
    @JsonProperty("guaranteedMoney")   long       guaranteedMoney,
    @JsonProperty("ltbeIncentives")    List<Long> ltbeIncentives,
    @JsonProperty("nltbeIncentives")   List<Long> nltbeIncentives,
    @JsonProperty("voidYears")         int        voidYears,
    @JsonProperty("offsetLanguage")    boolean    offsetLanguage
) {

    public ContractOffer {
        if (id == null || id.isBlank()) {
            throw new InvalidOfferException(String.valueOf(id), "offer id is required");
        }
        if (years <= 0) {
            throw new InvalidOfferException(id, "years must be positive, got " + years);
        }
        if (baseSalaryPerYear == null || baseSalaryPerYear.size() != years) {
            throw new InvalidOfferException(id, String.format(
                "expected %d base salaries, got %d",
                years, baseSalaryPerYear == null ? 0 : baseSalaryPerYear.size()));
        }
        if (voidYears < 0) {
            throw new InvalidOfferException(id, "voidYears cannot be negative");
        }
        if (signingBonus < 0 || guaranteedMoney < 0) {
            throw new InvalidOfferException(id, "signing bonus and guarantees cannot be negative");
        }
        baseSalaryPerYear = copyNonNegative(id, "base salary", baseSalaryPerYear);
        ltbeIncentives    = copyNonNegative(id, "LTBE incentive", ltbeIncentives);
        nltbeIncentives   = copyNonNegative(id, "NLTBE incentive", nltbeIncentives);

        long total = signingBonus;
        for (long salary : baseSalaryPerYear) {
            total += salary;
        }
        if (guaranteedMoney > total) {
            throw new InvalidOfferException(id, String.format(
                "guaranteed money %d exceeds total value %d", guaranteedMoney, total));
        }
    }

    /**
     * Offer with the same base salary every season and no incentives or void years.
     */
    public static ContractOffer flat(String id, int years, long baseSalary,
                                     long signingBonus, long guaranteedMoney) {
        if (years <= 0) {
            throw new InvalidOfferException(id, "years must be positive, got " + years);
        }
        return new ContractOffer(id, years, Collections.nCopies(years, baseSalary),
            signingBonus, guaranteedMoney, List.of(), List.of(), 0, false);
    }

    public ContractOffer withVoidYears(int voidYears) {
        return new ContractOffer(id, years, baseSalaryPerYear, signingBonus, guaranteedMoney,
            ltbeIncentives, nltbeIncentives, voidYears, offsetLanguage);
    }

    public ContractOffer withOffsetLanguage(boolean offsetLanguage) {
        return new ContractOffer(id, years, baseSalaryPerYear, signingBonus, guaranteedMoney,
            ltbeIncentives, nltbeIncentives, voidYears, offsetLanguage);
    }

    public ContractOffer withIncentives(List<Long> ltbeIncentives, List<Long> nltbeIncentives) {
        return new ContractOffer(id, years, baseSalaryPerYear, signingBonus, guaranteedMoney,
            ltbeIncentives, nltbeIncentives, voidYears, offsetLanguage);
    }

    private static List<Long> copyNonNegative(String id, String label, List<Long> amounts) {
        if (amounts == null) return List.of();
        List<Long> copy = new ArrayList<>(amounts.size());
        for (Long amount : amounts) {
            if (amount == null || amount < 0) {
                throw new InvalidOfferException(id, label + " must be a non-negative amount");
            }
            copy.add(amount);
        }
        return List.copyOf(copy);
    }
}
