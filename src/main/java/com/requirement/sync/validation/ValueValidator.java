package com.requirement.sync.validation;

import com.requirement.sync.core.model.AttributeKind;
import com.requirement.sync.snapshot.AttributeDefinitionSpec;
import com.requirement.sync.snapshot.RequirementTypeSpec;
import com.requirement.sync.snapshot.TrackerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Type-checks snapshot attribute values against their declared attribute kind.
 *
 * <p>Enumeration values must be lists of literal names of which at least one is
 * a declared option of the data type named like the attribute. Literals that are
 * not declared options are dropped from the canonical value.</p>
 *
 * <p>By default an invalid value fails with {@link InvalidFieldValueException}.
 * With default substitution enabled the kind's default value is returned instead.</p>
 */
public class ValueValidator {
    private static final Logger log = LoggerFactory.getLogger(ValueValidator.class);

    private final TrackerSnapshot snapshot;
    private final boolean substituteDefaults;

    public ValueValidator(TrackerSnapshot snapshot) {
        this(snapshot, false);
    }

    public ValueValidator(TrackerSnapshot snapshot, boolean substituteDefaults) {
        this.snapshot = snapshot;
        this.substituteDefaults = substituteDefaults;
    }

    /**
     * Validates {@code rawValue} for the attribute {@code name} of {@code requirementType}.
     *
     * @throws IllegalArgumentException   if the type does not declare the attribute
     * @throws InvalidFieldValueException if the value is invalid and defaults are not substituted
     */
    public ValidatedValue validate(String name, Object rawValue, RequirementTypeSpec requirementType) {
        AttributeDefinitionSpec definition = requirementType.attribute(name);
        if (definition == null) {
            throw new IllegalArgumentException("Attribute '" + name + "' is not declared on requirement type '"
                    + requirementType.longName() + "'");
        }

        AttributeKind kind = definition.kind();
        if (!kind.accepts(rawValue)) {
            return reject(name, rawValue, kind);
        }
        Object canonical = kind.canonicalize(rawValue);
        if (kind == AttributeKind.ENUM) {
            List<String> declared = declaredLiterals(name, castLiterals(canonical));
            if (declared.isEmpty()) {
                return reject(name, rawValue, kind);
            }
            return ValidatedValue.of(kind, declared);
        }
        return ValidatedValue.of(kind, canonical);
    }

    private List<String> declaredLiterals(String name, List<String> literals) {
        Set<String> options = snapshot.getOptions(name);
        List<String> declared = literals.stream()
                .filter(options::contains)
                .distinct()
                .toList();
        if (!declared.isEmpty() && declared.size() < literals.stream().distinct().count()) {
            log.warn("Dropping undeclared options of '{}': {} (declared: {})", name, literals, options);
        }
        return declared;
    }

    private ValidatedValue reject(String name, Object rawValue, AttributeKind kind) {
        if (substituteDefaults) {
            log.warn("Substituting default for invalid {} value of '{}': {}", kind.getLabel(), name, rawValue);
            return ValidatedValue.of(kind, kind.getDefaultValue());
        }
        throw new InvalidFieldValueException(name, rawValue,
                "Broken snapshot: Invalid field " + kind.getValueKey() + " '" + rawValue + "' for " + name);
    }

    @SuppressWarnings("unchecked")
    private static List<String> castLiterals(Object canonical) {
        return (List<String>) canonical;
    }
}
