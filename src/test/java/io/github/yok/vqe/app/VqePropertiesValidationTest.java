package io.github.yok.vqe.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.affinity.AffinityVerdict;
import java.util.List;
import java.util.Set;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class VqePropertiesValidationTest {

    private static ValidatorFactory factory;

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void validPropertiesHaveNoViolations() {
        assertTrue(validator.validate(withHamiltonian()).isEmpty());
    }

    @Test
    void nestedThresholdIsValidated() {
        VqeProperties properties = withHamiltonian();
        VqeProperties.Affinity.Threshold threshold = new VqeProperties.Affinity.Threshold();
        threshold.setBelow(-2.5);
        properties.getAffinity().setThresholds(List.of(threshold));

        Set<ConstraintViolation<VqeProperties>> violations = validator.validate(properties);

        assertEquals(1, violations.size());
        assertEquals("affinity.thresholds[0].verdict",
                violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void emptyHamiltonianIsRejected() {
        assertEquals(2, validator.validate(new VqeProperties()).size());
    }

    private static VqeProperties withHamiltonian() {
        VqeProperties properties = new VqeProperties();
        properties.getHamiltonian().setPaulis(List.of("ZZ"));
        properties.getHamiltonian().setCoefficients(List.of(1.0));
        VqeProperties.Affinity.Threshold threshold = new VqeProperties.Affinity.Threshold();
        threshold.setBelow(-2.5);
        threshold.setVerdict(AffinityVerdict.HIGH);
        properties.getAffinity().setThresholds(List.of(threshold));
        return properties;
    }
}
