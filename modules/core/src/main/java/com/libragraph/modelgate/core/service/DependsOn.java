package com.libragraph.modelgate.core.service;

import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Services that must be RUNNING before the annotated one starts. A failure of
 * any of them fails the annotated service; their recovery restarts it.
 */
@Inherited
@Target(TYPE)
@Retention(RUNTIME)
public @interface DependsOn {

    Class<? extends ManagedService>[] value();
}
