package io.fullerstack.inject.container;

import io.fullerstack.inject.Container;
import io.fullerstack.inject.Lifetime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class RegistrationTest {

    @Mock
    private Container container;

    @Test
    void factoryReceivesContainer() {
        Registration registration = new Registration(c -> c, Lifetime.TRANSIENT);

        assertThat(registration.create(container)).isSameAs(container);
    }

    @Test
    void newRegistrationHasEmptyCache() {
        Registration registration = new Registration(c -> "value", Lifetime.SINGLETON);

        assertThat(registration.cachedInstance()).isNull();
        assertThat(registration.lifetime()).isEqualTo(Lifetime.SINGLETON);
    }

    @Test
    void instanceRegistrationStartsCached() {
        Object instance = new Object();

        Registration registration = Registration.ofInstance(instance);

        assertThat(registration.lifetime()).isEqualTo(Lifetime.SINGLETON);
        assertThat(registration.cachedInstance()).isSameAs(instance);
        assertThat(registration.create(container)).isSameAs(instance);
    }

    @Test
    void singletonCacheKeepsLastWrite() {
        Registration registration = new Registration(c -> new Object(), Lifetime.SINGLETON);
        Object first = registration.create(container);
        Object second = registration.create(container);

        registration.cache(first);
        registration.cache(second);

        assertThat(registration.cachedInstance()).isSameAs(second);
    }

    @Test
    void transientRegistrationNeverCaches() {
        Registration registration = new Registration(c -> "value", Lifetime.TRANSIENT);

        assertThatThrownBy(() -> registration.cache("value"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(registration.cachedInstance()).isNull();
    }

    @Test
    void rejectsNullArguments() {
        assertThatThrownBy(() -> new Registration(null, Lifetime.TRANSIENT))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Registration(c -> "value", null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Registration.ofInstance(null))
            .isInstanceOf(NullPointerException.class);
    }
}
