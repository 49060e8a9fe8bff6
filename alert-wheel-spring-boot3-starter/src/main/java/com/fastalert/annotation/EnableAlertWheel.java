package com.fastalert.annotation;

import java.lang.annotation.*;

/**
 * 标在启动类上, value=false 时不恢复升级计划、不启动保留期清理
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableAlertWheel {

    /**
     * 是否启动
     */
    boolean value() default true;
}
