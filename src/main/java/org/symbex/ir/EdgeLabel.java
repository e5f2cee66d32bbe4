package org.symbex.ir;

/**
 * 控制流边的标签。
 */
public enum EdgeLabel {

    /** 无条件跳转（顺序执行、break、continue 到循环尾） */
    JUMP,
    /** 从循环前置块进入循环头，清空该循环头的迭代计数 */
    LOOP_ENTRY,
    /** 从循环体回到循环头 */
    LOOP_BACK,
    TRUE,
    FALSE,
    LOOP_CONTINUE,
    LOOP_EXIT
}
