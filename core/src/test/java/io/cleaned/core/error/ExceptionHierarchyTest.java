package io.cleaned.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import org.junit.jupiter.api.Test;

/** Verifies the two-phase exception structure and the fields every exception carries. */
class ExceptionHierarchyTest {

    @Test
    void cleanedExceptionIsAbstractAndRoot() {
        assertThat(CleanedException.class).isAbstract();
        assertThat(CleanedException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void schemaDefinitionExceptionIsDefinitionPhase() {
        var ex = new SchemaDefinitionException("Duplicate field 'age'", "person");

        assertThat(ex).isInstanceOf(CleanedException.class);
        assertThat(ex.schemaName()).isEqualTo("person");
        assertThat(ex).hasMessage("Duplicate field 'age'");
        assertThat(ex.phase()).isEqualTo(CleanedException.Phase.DEFINITION);
        assertThat(ex.phase().blamesInput()).isFalse();
    }

    @Test
    void schemaDefinitionExceptionKeepsCause() {
        var cause = new IllegalStateException("boom");
        var ex = new SchemaDefinitionException("cannot resolve", cause, "person");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(CleanedException.Phase.DEFINITION);
    }

    @Test
    void validationErrorIsValidationPhase() {
        var errors = ErrorNode.branch().put(PathSegment.name("age"), Failure.required()).build();
        var ex = new ValidationError("person", errors);

        assertThat(ex).isInstanceOf(CleanedException.class);
        assertThat(ex.schemaName()).isEqualTo("person");
        assertThat(ex.phase()).isEqualTo(CleanedException.Phase.VALIDATION);
        assertThat(ex.phase().blamesInput()).isTrue();
        assertThat(ex.getStackTrace()).isNotEmpty();
    }

    @Test
    void nestedViewHasNoStackTrace() {
        var inner = ErrorNode.branch().put(PathSegment.name("zip"), Failure.required()).build();
        var ex = new ValidationError("person", ErrorNode.branch().put(PathSegment.name("address"), inner).build());

        assertThat(ex.nested("address")).hasValueSatisfying(nested -> {
            assertThat(nested.schemaName()).isEqualTo("person.address");
            assertThat(nested.phase()).isEqualTo(CleanedException.Phase.VALIDATION);
            assertThat(nested.getStackTrace()).isEmpty();
        });
    }

    @Test
    void concreteExceptionsAreFinal() {
        assertThat(SchemaDefinitionException.class).isFinal();
        assertThat(ValidationError.class).isFinal();
    }
}
