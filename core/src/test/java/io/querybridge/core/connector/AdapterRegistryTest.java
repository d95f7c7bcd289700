package io.querybridge.core.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.querybridge.core.adapter.DataSourceAdapter;
import io.querybridge.core.adapter.memory.MemoryAdapter;
import io.querybridge.core.error.ConfigValidationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdapterRegistry")
class AdapterRegistryTest {

    private final AdapterRegistry registry = new AdapterRegistry();

    @Test
    void createsOneSharedInstancePerType() {
        AtomicInteger created = new AtomicInteger();
        registry.register("memory", () -> {
            created.incrementAndGet();
            return new MemoryAdapter();
        });

        DataSourceAdapter first = registry.adapter("memory");
        DataSourceAdapter second = registry.adapter("memory");

        assertThat(first).isSameAs(second);
        assertThat(created).hasValue(1);
        assertThat(registry.isRegistered("memory")).isTrue();
    }

    @Test
    void unknownTypeListsRegisteredOnes() {
        registry.register("sql", () -> mock(DataSourceAdapter.class));
        registry.register("memory", MemoryAdapter::new);

        assertThatThrownBy(() -> registry.adapter("graph"))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessage("Unsupported data source type: graph (registered: [memory, sql])");
    }

    @Test
    void replacingFactoryDestroysOldInstance() {
        DataSourceAdapter old = mock(DataSourceAdapter.class);
        DataSourceAdapter replacement = mock(DataSourceAdapter.class);
        registry.register("api", () -> old);
        registry.adapter("api");

        registry.register("api", () -> replacement);

        verify(old).destroy();
        assertThat(registry.adapter("api")).isSameAs(replacement);
    }

    @Test
    void destroyAllKeepsFactoriesAndSurvivesFailures() {
        DataSourceAdapter failing = mock(DataSourceAdapter.class);
        DataSourceAdapter healthy = mock(DataSourceAdapter.class);
        DataSourceAdapter unused = mock(DataSourceAdapter.class);
        doThrow(new IllegalStateException("boom")).when(failing).destroy();
        registry.register("a", () -> failing);
        registry.register("b", () -> healthy);
        registry.register("c", () -> unused);
        registry.adapter("a");
        registry.adapter("b");

        registry.destroyAll();

        verify(failing).destroy();
        verify(healthy).destroy();
        verify(unused, never()).destroy();
        assertThat(registry.types()).containsExactly("a", "b", "c");
    }
}
