package com.fitnexus.backend.modules.trainer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import com.fitnexus.backend.modules.trainer.domain.Specializations;

import org.junit.jupiter.api.Test;

class SpecializationsTest {

    @Test
    void splitTrimsAndDropsBlanks() {
        assertThat(Specializations.split(" Yoga , ,Pilates,, HIIT ")).containsExactly("Yoga", "Pilates", "HIIT");
    }

    @Test
    void splitOfEmptyOrMissingIsEmptyList() {
        assertThat(Specializations.split(null)).isEmpty();
        assertThat(Specializations.split("")).isEmpty();
        assertThat(Specializations.split(" , ")).isEmpty();
    }

    @Test
    void joinSkipsBlanksAndDuplicates() {
        assertThat(Specializations.join(Arrays.asList("Yoga", " ", null, "Pilates", "Yoga"))).isEqualTo("Yoga,Pilates");
        assertThat(Specializations.join(null)).isEmpty();
    }

    @Test
    void joinRejectsValuesContainingDelimiter() {
        assertThatThrownBy(() -> Specializations.join(List.of("Yoga,Pilates")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
