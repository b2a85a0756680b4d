package com.goormthonuniv.derigo.reference;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 한 번만 초기화되는 참조 데이터 핸들.
 * 동시에 여러 호출자가 들어오면 첫 호출자만 로더를 실행하고 나머지는 같은 로드 결과를 기다린다.
 * 로더가 예외나 Error 를 던지면 슬롯을 비워 다음 호출에서 다시 시도한다.
 */
public final class LazyReference<T> {

    private final Supplier<T> loader;
    private final AtomicReference<CompletableFuture<T>> slot = new AtomicReference<>();

    public LazyReference(Supplier<T> loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /** 이미 로드된 값으로 고정된 핸들(테스트/정적 테이블용) */
    public static <T> LazyReference<T> of(T value) {
        LazyReference<T> ref = new LazyReference<>(() -> value);
        ref.slot.set(CompletableFuture.completedFuture(value));
        return ref;
    }

    public T get() {
        CompletableFuture<T> current = slot.get();
        if (current == null) {
            CompletableFuture<T> mine = new CompletableFuture<>();
            if (slot.compareAndSet(null, mine)) {
                try {
                    mine.complete(loader.get());
                } catch (Throwable t) {
                    // Error 포함: 대기 중인 호출자가 영원히 막히지 않도록 반드시 완료시킨다
                    slot.compareAndSet(mine, null);
                    mine.completeExceptionally(t);
                    throw t;
                }
                current = mine;
            } else {
                current = slot.get();
            }
        }
        return current.join();
    }

    public boolean isLoaded() {
        CompletableFuture<T> current = slot.get();
        return current != null && current.isDone() && !current.isCompletedExceptionally();
    }
}
