package com.vidnyan.cga.adapter.out.sensitivity;

import com.vidnyan.cga.domain.graph.Sensitivity;
import com.vidnyan.cga.domain.graph.SensitivityClassifier;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name-based sensitivity classification. Rules are checked in order and the first match wins,
 * so credential patterns shadow the broader financial and personal ones.
 * A table is classified by its singular name against the same rules as a field.
 */
public class PatternSensitivityClassifier implements SensitivityClassifier {

    private static final List<Rule> RULES = List.of(
            rule(Sensitivity.CREDENTIALS, "^password$", "password[_-]?hash$", "hashed[_-]?password$", "pwd$",
                    "passwd$", "pass[_-]?phrase$"),
            rule(Sensitivity.CREDENTIALS, "api[_-]?key$", "api[_-]?secret$", "secret[_-]?key$", "access[_-]?key$",
                    "private[_-]?key$"),
            rule(Sensitivity.CREDENTIALS, "^token$", "auth[_-]?token$", "access[_-]?token$", "refresh[_-]?token$",
                    "session[_-]?token$", "jwt$", "bearer[_-]?token$"),
            rule(Sensitivity.CREDENTIALS, "^secret$", "client[_-]?secret$", "encryption[_-]?key$",
                    "signing[_-]?key$", "master[_-]?key$"),
            rule(Sensitivity.CREDENTIALS, "mfa[_-]?secret$", "totp[_-]?secret$", "two[_-]?factor[_-]?secret$",
                    "recovery[_-]?code", "backup[_-]?code"),
            rule(Sensitivity.FINANCIAL, "credit[_-]?card", "card[_-]?number", "cc[_-]?number", "pan$",
                    "primary[_-]?account[_-]?number"),
            rule(Sensitivity.FINANCIAL, "^cvv$", "^cvc$", "^cvv2$", "security[_-]?code$", "card[_-]?verification"),
            rule(Sensitivity.FINANCIAL, "bank[_-]?account", "account[_-]?number", "routing[_-]?number", "iban$",
                    "swift[_-]?code", "bic$"),
            rule(Sensitivity.FINANCIAL, "^salary$", "^income$", "^wage$", "wage[_-]?rate", "hourly[_-]?rate",
                    "compensation", "net[_-]?worth", "tax[_-]?return", "pay[_-]?rate", "payroll"),
            rule(Sensitivity.PII, "^ssn$", "social[_-]?security", "national[_-]?id", "national[_-]?insurance",
                    "tax[_-]?id", "tin$", "ein$"),
            rule(Sensitivity.PII, "passport[_-]?number", "driver[_-]?license", "license[_-]?number",
                    "id[_-]?number"),
            rule(Sensitivity.PII, "date[_-]?of[_-]?birth", "^dob$", "birth[_-]?date", "birthday"),
            rule(Sensitivity.PII, "^email$", "email[_-]?address", "e[_-]?mail"),
            rule(Sensitivity.PII, "phone[_-]?number", "mobile[_-]?number", "cell[_-]?phone", "telephone"),
            rule(Sensitivity.PII, "^address$", "street[_-]?address", "home[_-]?address", "mailing[_-]?address",
                    "postal[_-]?address"),
            rule(Sensitivity.PII, "^ip[_-]?address$", "client[_-]?ip", "user[_-]?ip"),
            rule(Sensitivity.PII, "biometric", "fingerprint", "face[_-]?id", "retina", "voice[_-]?print"),
            rule(Sensitivity.PII, "^race$", "ethnicity", "religion", "political[_-]?affiliation",
                    "sexual[_-]?orientation", "gender[_-]?identity"),
            rule(Sensitivity.HEALTH, "diagnosis", "medical[_-]?condition", "health[_-]?condition", "disease",
                    "illness"),
            rule(Sensitivity.HEALTH, "prescription", "medication", "drug[_-]?name", "dosage"),
            rule(Sensitivity.HEALTH, "medical[_-]?record", "health[_-]?record", "patient[_-]?record", "ehr$", "emr$"),
            rule(Sensitivity.HEALTH, "insurance[_-]?id", "insurance[_-]?member[_-]?id", "policy[_-]?number",
                    "health[_-]?plan[_-]?id", "beneficiary[_-]?id"),
            rule(Sensitivity.HEALTH, "lab[_-]?result", "test[_-]?result", "blood[_-]?type", "genetic", "dna"));

    @Override
    public Sensitivity classify(String table, String field) {
        String name = field != null ? field : singular(table);
        if (name == null || name.isBlank()) {
            return Sensitivity.UNKNOWN;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(normalized)) {
                return rule.sensitivity();
            }
        }
        return Sensitivity.UNKNOWN;
    }

    private static String singular(String table) {
        if (table == null) {
            return null;
        }
        return table.endsWith("s") && table.length() > 1 ? table.substring(0, table.length() - 1) : table;
    }

    private static Rule rule(Sensitivity sensitivity, String... patterns) {
        return new Rule(sensitivity, Arrays.stream(patterns)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList());
    }

    private record Rule(Sensitivity sensitivity, List<Pattern> patterns) {

        boolean matches(String name) {
            return patterns.stream().anyMatch(p -> p.matcher(name).find());
        }
    }
}
