package superdarn.fov.model;

/**
 * 视场方向
 *
 * 干涉仪相位差只能确定到前/后视场的模糊度，FRONT对应标志1，BACK对应标志-1。
 */
public enum FieldOfView {

    FRONT(1),
    BACK(-1);

    private final int flag;

    FieldOfView(int flag) {
        this.flag = flag;
    }

    /**
     * @return 视场标志（1=前，-1=后）
     */
    public int getFlag() {
        return flag;
    }

    public FieldOfView opposite() {
        return this == FRONT ? BACK : FRONT;
    }

    /**
     * 由视场标志转换
     *
     * @param flag 1 或 -1
     * @return 对应视场，0或其它值返回null（未确定）
     */
    public static FieldOfView fromFlag(int flag) {
        if (flag == 1) {
            return FRONT;
        }
        if (flag == -1) {
            return BACK;
        }
        return null;
    }
}
