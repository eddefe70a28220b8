package com.diagramforge.core.repair;

import com.diagramforge.core.validate.StructuralValidator;
import com.diagramforge.core.validate.StructuralViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Validate-and-fix entry point.
 *
 * <p>Validates once. An invalid document goes through the auto-fix pipeline exactly once
 * and is validated again.
 */
public class XmlRepairService {

    private static final Logger log = LoggerFactory.getLogger(XmlRepairService.class);

    private final StructuralValidator validator;
    private final XmlAutoFixer fixer;

    public XmlRepairService(StructuralValidator validator, XmlAutoFixer fixer) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.fixer = Objects.requireNonNull(fixer, "fixer must not be null");
    }

    public ValidationReport validateAndFix(String xml) {
        Optional<StructuralViolation> initial = validator.validate(xml);
        if (initial.isEmpty()) {
            return ValidationReport.ofValid();
        }
        log.debug("Document invalid, attempting auto-fix: {}", initial.get().describe());

        RepairResult repair;
        try {
            repair = fixer.fix(xml);
        } catch (RuntimeException e) {
            log.warn("Auto-fix failed unexpectedly: {}", e.getMessage(), e);
            return new ValidationReport(false, initial.get(), null, null);
        }
        if (!repair.changed()) {
            return new ValidationReport(false, initial.get(), null, repair.fixes());
        }

        Optional<StructuralViolation> after = validator.validate(repair.xml());
        if (after.isPresent()) {
            log.warn("Document still invalid after {} fixes: {}", repair.fixes().size(), after.get().code());
        } else {
            log.debug("Document repaired with {} fixes", repair.fixes().size());
        }
        return new ValidationReport(after.isEmpty(), after.orElse(null), repair.xml(), repair.fixes());
    }
}
