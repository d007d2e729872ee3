package com.tollgate.proxy.core.proxy.impl.http.middleware;

import com.tollgate.proxy.core.exceptions.MiddlewareException;
import com.tollgate.proxy.core.proxy.ProxyResponse;
import com.tollgate.proxy.core.proxy.RequestContext;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MiddlewareChainTest {

    private final RequestContext ctx = new RequestContext("GET", URI.create("http://api.local/"), Map.of(),
            "127.0.0.1");

    @Test
    void execute_runsInOrderUntilShortCircuit() {
        List<String> calls = new CopyOnWriteArrayList<>();
        MiddlewareChain chain = new MiddlewareChain()
                .add(c -> {
                    calls.add("first");
                    return null;
                })
                .add(c -> {
                    calls.add("second");
                    return ProxyResponse.error(418, "teapot");
                })
                .add(c -> {
                    calls.add("third");
                    return null;
                });

        ProxyResponse response = chain.execute(ctx);

        assertThat(response.getStatus()).isEqualTo(418);
        assertThat(calls).containsExactly("first", "second");
        assertThat(chain.size()).isEqualTo(3);
    }

    @Test
    void execute_stopsAtFirstRejection() {
        List<String> calls = new CopyOnWriteArrayList<>();
        MiddlewareChain chain = new MiddlewareChain()
                .add(c -> {
                    throw new MiddlewareException("blocked");
                })
                .add(c -> {
                    calls.add("second");
                    return null;
                });

        assertThatThrownBy(() -> chain.execute(ctx))
                .isInstanceOfSatisfying(MiddlewareException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(MiddlewareException.DEFAULT_STATUS));
        assertThat(calls).isEmpty();
    }

    @Test
    void execute_returnsNullWhenAllPass() {
        MiddlewareChain chain = new MiddlewareChain().add(c -> null);

        assertThat(chain.execute(ctx)).isNull();
    }

    @Test
    void complete_notifiesEveryMiddleware() {
        List<Integer> statuses = new CopyOnWriteArrayList<>();
        Middleware recorder = new Middleware() {
            @Override
            public ProxyResponse preHandle(RequestContext context) {
                return null;
            }

            @Override
            public void postHandle(RequestContext context, int statusCode) {
                statuses.add(statusCode);
            }
        };
        MiddlewareChain chain = new MiddlewareChain().add(recorder).add(recorder);

        chain.complete(ctx, 204);

        assertThat(statuses).containsExactly(204, 204);
    }
}
