package org.yourcompany.tetrisrules.config;

/**
 * 1 回の判定（{@code Scorer.judge}）の結果。
 * 加算されたスコアと、ライン消去・スピン・B2B・コンボの状態を保持します。
 */
public class ClearInfo {
    private final String clearType;
    private final int linesCleared;
    private final SpinType spinType;
    private final int backToBack;
    private final int comboCount;
    private final boolean isPerfectClear;
    private final long scoreDelta;

    public ClearInfo(String clearType, int linesCleared, SpinType spinType, int backToBack,
                     int comboCount, boolean isPerfectClear, long scoreDelta) {
        this.clearType = clearType;
        this.linesCleared = linesCleared;
        this.spinType = spinType;
        this.backToBack = backToBack;
        this.comboCount = comboCount;
        this.isPerfectClear = isPerfectClear;
        this.scoreDelta = scoreDelta;
    }

    /**
     * ライン消去を伴わない操作の結果を作成します。
     */
    public static ClearInfo noClear(SpinType spinType, int backToBack, int comboCount, long scoreDelta) {
        return new ClearInfo("", 0, spinType, backToBack, comboCount, false, scoreDelta);
    }

    /**
     * 表示用の消去名を作成します (例: "T-SPIN DOUBLE", "QUAD")。
     */
    public static String createClearTypeText(int linesCleared, SpinType spinType, boolean perfectClear) {
        String clearType = "";
        if (spinType == SpinType.T_SPIN) clearType = "T-SPIN ";
        else if (spinType == SpinType.T_SPIN_MINI) clearType = "T-SPIN MINI ";

        switch (linesCleared) {
            case 1: clearType += "SINGLE"; break;
            case 2: clearType += "DOUBLE"; break;
            case 3: clearType += "TRIPLE"; break;
            case 4: clearType = "QUAD"; break;
            default: clearType = clearType.trim(); break;
        }
        if (perfectClear && linesCleared > 0) {
            clearType = "PERFECT CLEAR " + clearType;
        }
        return clearType;
    }

    public String getClearType() { return clearType; }
    public int getLinesCleared() { return linesCleared; }
    public SpinType getSpinType() { return spinType; }
    public int getBackToBack() { return backToBack; }
    public boolean isB2B() { return backToBack > 1; }
    public int getComboCount() { return comboCount; }
    public boolean isPerfectClear() { return isPerfectClear; }
    public long getScoreDelta() { return scoreDelta; }

    @Override
    public String toString() {
        return "ClearInfo[" + (clearType.isEmpty() ? "-" : clearType)
                + ", lines=" + linesCleared
                + ", b2b=" + backToBack
                + ", combo=" + comboCount
                + ", +" + scoreDelta + "]";
    }
}
